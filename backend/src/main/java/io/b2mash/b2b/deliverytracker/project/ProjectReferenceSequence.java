package io.b2mash.b2b.deliverytracker.project;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Allocates human-readable references per project and prefix ({@code MS-001}, {@code DEL-014},
 * {@code VAR-003}). Backed by an upsert on {@code project_reference_counters}, so concurrent
 * allocations for the same prefix serialize on a single counter row and never collide.
 */
@Component
public class ProjectReferenceSequence {

  private static final String NEXT_VALUE_SQL =
      """
      INSERT INTO project_reference_counters (project_id, prefix, last_value)
      VALUES (:projectId, :prefix, 1)
      ON CONFLICT (project_id, prefix)
      DO UPDATE SET last_value = project_reference_counters.last_value + 1
      RETURNING last_value
      """;

  @PersistenceContext private EntityManager entityManager;

  @Transactional(propagation = Propagation.MANDATORY)
  public String next(UUID projectId, String prefix) {
    Number value =
        (Number)
            entityManager
                .createNativeQuery(NEXT_VALUE_SQL)
                .setParameter("projectId", projectId)
                .setParameter("prefix", prefix)
                .getSingleResult();
    return String.format("%s-%03d", prefix, value.intValue());
  }
}
