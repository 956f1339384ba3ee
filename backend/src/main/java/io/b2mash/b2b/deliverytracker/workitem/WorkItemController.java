package io.b2mash.b2b.deliverytracker.workitem;

import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
public class WorkItemController {

  private final HierarchyService hierarchyService;

  public WorkItemController(HierarchyService hierarchyService) {
    this.hierarchyService = hierarchyService;
  }

  @GetMapping("/api/projects/{projectId}/work-items")
  public ResponseEntity<List<WorkItemTreeResponse>> getTree(
      @PathVariable UUID projectId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        hierarchyService.tree(projectId, CurrentMember.id(jwt)).stream()
            .map(WorkItemTreeResponse::from)
            .toList());
  }

  @PostMapping("/api/projects/{projectId}/work-items")
  public ResponseEntity<WorkItemResponse> createItem(
      @PathVariable UUID projectId,
      @Valid @RequestBody CreateWorkItemRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    var item =
        hierarchyService.createItem(
            projectId,
            request.kind(),
            request.parentId(),
            request.toAttributes(),
            CurrentMember.id(jwt));
    return ResponseEntity.created(URI.create("/api/work-items/" + item.getId()))
        .body(WorkItemResponse.from(item));
  }

  @GetMapping("/api/work-items/{id}")
  public ResponseEntity<WorkItemResponse> getItem(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(hierarchyService.getItem(id, CurrentMember.id(jwt))));
  }

  @PutMapping("/api/work-items/{id}")
  public ResponseEntity<WorkItemResponse> updateItem(
      @PathVariable UUID id,
      @Valid @RequestBody UpdateWorkItemRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    var attributes =
        new WorkItemAttributes(
            request.name(),
            request.description(),
            request.startDate(),
            request.endDate(),
            request.value(),
            request.estimateComponentId(),
            null);
    return ResponseEntity.ok(
        WorkItemResponse.from(
            hierarchyService.updateItem(
                id, attributes, request.expectedVersion(), CurrentMember.id(jwt))));
  }

  @PostMapping("/api/work-items/{id}/move")
  public ResponseEntity<WorkItemResponse> move(
      @PathVariable UUID id, @RequestBody MoveRequest request, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(
            hierarchyService.move(
                id,
                request.newParentId(),
                request.position(),
                request.expectedVersion(),
                CurrentMember.id(jwt))));
  }

  @PostMapping("/api/work-items/{id}/indent")
  public ResponseEntity<WorkItemResponse> indent(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(hierarchyService.indent(id, CurrentMember.id(jwt))));
  }

  @PostMapping("/api/work-items/{id}/outdent")
  public ResponseEntity<WorkItemResponse> outdent(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(hierarchyService.outdent(id, CurrentMember.id(jwt))));
  }

  @PutMapping("/api/projects/{projectId}/work-items/order")
  public ResponseEntity<List<WorkItemResponse>> reorder(
      @PathVariable UUID projectId,
      @Valid @RequestBody ReorderRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        hierarchyService
            .reorder(projectId, request.parentId(), request.orderedChildIds(), CurrentMember.id(jwt))
            .stream()
            .map(WorkItemResponse::from)
            .toList());
  }

  @DeleteMapping("/api/work-items/{id}")
  public ResponseEntity<Void> deleteItem(@PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    hierarchyService.softDelete(id, CurrentMember.id(jwt));
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/work-items/{id}/restore")
  public ResponseEntity<WorkItemResponse> restore(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(hierarchyService.restore(id, CurrentMember.id(jwt))));
  }

  // --- DTOs ---

  public record CreateWorkItemRequest(
      @NotNull(message = "kind is required") WorkItemKind kind,
      UUID parentId,
      @NotBlank(message = "name is required") @Size(max = 500) String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      BigDecimal value,
      UUID estimateComponentId,
      Integer position) {

    WorkItemAttributes toAttributes() {
      return new WorkItemAttributes(
          name, description, startDate, endDate, value, estimateComponentId, position);
    }
  }

  public record UpdateWorkItemRequest(
      @NotBlank(message = "name is required") @Size(max = 500) String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      BigDecimal value,
      UUID estimateComponentId,
      Integer expectedVersion) {}

  public record MoveRequest(UUID newParentId, Integer position, Integer expectedVersion) {}

  public record ReorderRequest(
      UUID parentId, @NotNull(message = "orderedChildIds is required") List<UUID> orderedChildIds) {}

  public record WorkItemResponse(
      UUID id,
      UUID projectId,
      WorkItemKind kind,
      UUID parentId,
      String itemRef,
      String wbs,
      int position,
      String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      Integer durationDays,
      Integer progress,
      DeliverableStatus deliverableStatus,
      BigDecimal value,
      boolean billed,
      int version,
      Instant updatedAt) {

    public static WorkItemResponse from(WorkItem item) {
      return new WorkItemResponse(
          item.getId(),
          item.getProjectId(),
          item.getKind(),
          item.getParentId(),
          item.getItemRef(),
          item.getWbs(),
          item.getPosition(),
          item.getName(),
          item.getDescription(),
          item.getStartDate(),
          item.getEndDate(),
          item.getDurationDays(),
          item.getKind() == WorkItemKind.MILESTONE ? null : item.getProgress(),
          item.getDeliverableStatus(),
          item.getValue(),
          item.isBilled(),
          item.getVersion(),
          item.getUpdatedAt());
    }
  }

  public record WorkItemTreeResponse(WorkItemResponse item, List<WorkItemTreeResponse> children) {

    public static WorkItemTreeResponse from(WorkItemNode node) {
      return new WorkItemTreeResponse(
          WorkItemResponse.from(node.item()),
          node.children().stream().map(WorkItemTreeResponse::from).toList());
    }
  }
}
