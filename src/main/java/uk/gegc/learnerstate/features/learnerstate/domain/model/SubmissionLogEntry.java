package uk.gegc.learnerstate.features.learnerstate.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Getter
@Setter
@Table(
        name = "submission_log",
        indexes = {
                @Index(name = "idx_submission_log_user_time", columnList = "user_id, submitted_at")
        }
)
public class SubmissionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "question_id", length = 64, nullable = false)
    private String questionId;

    @Column(name = "success", nullable = false)
    private Boolean success;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @Column(name = "error_pattern", length = 128)
    private String errorPattern;

    @Column(name = "quality")
    private Integer quality;
}
