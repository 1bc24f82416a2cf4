package com.eyelevel.dispatcher.model;

import com.eyelevel.dispatcher.model.converter.ScheduleConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A file in the context of one submission. The same content hash may appear in several submissions
 * and is dispatched once per submission.
 */
@Entity
@Table(name = "submission_file", uniqueConstraints = @UniqueConstraint(columnNames = {"submission_id", "sha256"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionFile implements ExpirableRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submission_id", nullable = false)
    private String submissionId;

    @Column(nullable = false)
    private String sha256;

    private String fileType;

    /**
     * The file this one was extracted from, {@code null} for submitted files.
     */
    private String parentSha256;

    private int depth;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileDispatchState state;

    /**
     * Index of the current stage in the schedule; -1 before the first stage is dispatched.
     */
    private int stageIndex;

    @Builder.Default
    @Convert(converter = ScheduleConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<List<ScheduledService>> schedule = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String errorAnnotation;

    private LocalDateTime expiryTs;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Override
    public String getStorageKey() {
        return String.valueOf(id);
    }
}
