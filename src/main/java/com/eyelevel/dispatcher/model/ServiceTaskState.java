package com.eyelevel.dispatcher.model;

import jakarta.persistence.Column;
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

/**
 * Tracks one (file, service) pair of a submission. Outstanding work for a stage is the set of
 * {@link TaskStatus#QUEUED} rows, so there is no counter to drift.
 */
@Entity
@Table(name = "service_task_state",
       uniqueConstraints = @UniqueConstraint(columnNames = {"submission_id", "sha256", "service_name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceTaskState implements ExpirableRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submission_id", nullable = false)
    private String submissionId;

    @Column(nullable = false)
    private String sha256;

    @Column(name = "service_name", nullable = false)
    private String serviceName;

    private int stageIndex;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status;

    private int failureCount;

    private int failureLimit;

    @Column(nullable = false)
    private String resultKey;

    @Column(columnDefinition = "TEXT")
    private String lastError;

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
