package uk.gegc.learnerstate.features.learnerstate.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Stored form of a learner state: the JSON snapshot plus the optimistic-lock version.
 */
@Entity
@Getter
@Setter
@Table(name = "learner_state")
public class LearnerStateDocument {

    @Id
    @Column(name = "user_id", length = 64, updatable = false, nullable = false)
    private String userId;

    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;

    @Column(name = "schema_version", length = 16, nullable = false)
    private String schemaVersion;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
