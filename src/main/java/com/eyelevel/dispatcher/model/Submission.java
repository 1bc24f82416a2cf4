package com.eyelevel.dispatcher.model;

import com.eyelevel.dispatcher.model.converter.ServiceParamsConverter;
import com.eyelevel.dispatcher.model.converter.StringSetConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Represents the top-level entity for an analysis request: a bundle of files routed through the
 * services selected by category or name.
 */
@Entity
@Table(name = "submission")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Submission implements ExpirableRecord {

    @Id
    @Column(nullable = false)
    private String sid;

    /**
     * Category or service names to run. Empty means every registered service.
     */
    @Builder.Default
    @Convert(converter = StringSetConverter.class)
    @Column(columnDefinition = "TEXT")
    private Set<String> selectedCategories = new HashSet<>();

    @Builder.Default
    @Convert(converter = StringSetConverter.class)
    @Column(columnDefinition = "TEXT")
    private Set<String> excludedCategories = new HashSet<>();

    /**
     * Per-service parameters overriding the service defaults, keyed by service name.
     */
    @Builder.Default
    @Convert(converter = ServiceParamsConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Map<String, Object>> serviceParams = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubmissionStatus status;

    /**
     * A summary of how the submission's service tasks were resolved, written on completion.
     */
    @Column(columnDefinition = "TEXT")
    private String remark;

    private int errorCount;

    private boolean archived;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    private LocalDateTime expiryTs;

    @Override
    public String getStorageKey() {
        return sid;
    }
}
