package io.b2mash.b2b.deliverytracker.workitem;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.b2b.deliverytracker.TestcontainersConfiguration;
import io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class WorkItemControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;

  private final UUID adminId = UUID.randomUUID();
  private final UUID supplierId = UUID.randomUUID();
  private final UUID customerId = UUID.randomUUID();
  private String projectId;
  private String milestoneId;

  @BeforeAll
  void createProjectAndMembers() throws Exception {
    var projectResult =
        mockMvc
            .perform(
                post("/api/projects")
                    .with(orgAdminJwt(adminId))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "API Project", "reference": "%s"}
                        """
                            .formatted(TestProjectFixture.uniqueReference())))
            .andExpect(status().isCreated())
            .andReturn();
    projectId = extractIdFromLocation(projectResult);

    addMember(supplierId, "SUPPLIER_PM");
    addMember(customerId, "CUSTOMER_PM");

    var milestoneResult =
        mockMvc
            .perform(
                post("/api/projects/" + projectId + "/work-items")
                    .with(memberJwt(adminId))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"kind": "MILESTONE", "name": "Phase 1",
                         "startDate": "2026-06-01", "endDate": "2026-06-30", "value": 20000}
                        """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.wbs").value("1"))
            .andExpect(jsonPath("$.durationDays").value(30))
            .andExpect(jsonPath("$.progress").doesNotExist())
            .andReturn();
    milestoneId = JsonPath.read(milestoneResult.getResponse().getContentAsString(), "$.id");
  }

  @Test
  void createsDeliverableUnderMilestone() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/" + projectId + "/work-items")
                .with(memberJwt(supplierId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"kind": "DELIVERABLE", "parentId": "%s", "name": "Design"}
                    """
                        .formatted(milestoneId)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.deliverableStatus").value("DRAFT"))
        .andExpect(jsonPath("$.parentId").value(milestoneId));
  }

  @Test
  void taskUnderMilestoneIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/" + projectId + "/work-items")
                .with(memberJwt(supplierId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"kind": "TASK", "parentId": "%s", "name": "Stray"}
                    """
                        .formatted(milestoneId)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("type_constraint"));
  }

  @Test
  void missingNameFailsValidation() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/" + projectId + "/work-items")
                .with(memberJwt(supplierId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"kind": "MILESTONE"}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void staleExpectedVersionIsRejected() throws Exception {
    mockMvc
        .perform(
            put("/api/work-items/" + milestoneId)
                .with(memberJwt(adminId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Phase 1 renamed", "expectedVersion": 999}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("stale_version"));
  }

  @Test
  void treeIsVisibleToMembers() throws Exception {
    mockMvc
        .perform(get("/api/projects/" + projectId + "/work-items").with(memberJwt(customerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].item.id").value(milestoneId));
  }

  @Test
  void nonMemberIsForbidden() throws Exception {
    mockMvc
        .perform(
            get("/api/projects/" + projectId + "/work-items").with(memberJwt(UUID.randomUUID())))
        .andExpect(status().isForbidden());
  }

  @Test
  void unauthenticatedRequestIsRejected() throws Exception {
    mockMvc
        .perform(get("/api/projects/" + projectId + "/work-items"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void workflowViewIsServedForTheCaller() throws Exception {
    mockMvc
        .perform(
            get("/api/projects/" + projectId + "/workflow/pending").with(memberJwt(customerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").isNumber())
        .andExpect(jsonPath("$.unavailableCategories").isEmpty());
  }

  private void addMember(UUID memberId, String role) throws Exception {
    mockMvc
        .perform(
            post("/api/projects/" + projectId + "/members")
                .with(memberJwt(adminId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"memberId": "%s", "role": "%s"}
                    """
                        .formatted(memberId, role)))
        .andExpect(status().isCreated());
  }

  private JwtRequestPostProcessor orgAdminJwt(UUID memberId) {
    return jwt()
        .jwt(j -> j.subject(memberId.toString()).claim("org_role", "admin"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_ORG_ADMIN")));
  }

  private JwtRequestPostProcessor memberJwt(UUID memberId) {
    return jwt()
        .jwt(j -> j.subject(memberId.toString()).claim("org_role", "member"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_ORG_MEMBER")));
  }

  private String extractIdFromLocation(MvcResult result) {
    String location = result.getResponse().getHeader("Location");
    return location.substring(location.lastIndexOf('/') + 1);
  }
}
