package com.eyelevel.dispatcher.model;

import com.eyelevel.dispatcher.model.converter.ExtractedFilesConverter;
import com.eyelevel.dispatcher.model.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The output of one service for one file under one configuration. The key is derived from
 * (sha256, service, version, config hash), so a later task with the same key reuses it.
 */
@Entity
@Table(name = "analysis_result")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult implements ExpirableRecord {

    @Id
    @Column(nullable = false)
    private String resultKey;

    @Column(nullable = false)
    private String sha256;

    @Column(nullable = false)
    private String serviceName;

    private String version;

    private String configHash;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> response = new HashMap<>();

    @Builder.Default
    @Convert(converter = ExtractedFilesConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<ExtractedFile> extractedFiles = new ArrayList<>();

    private boolean archived;

    private LocalDateTime expiryTs;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Override
    public String getStorageKey() {
        return resultKey;
    }
}
