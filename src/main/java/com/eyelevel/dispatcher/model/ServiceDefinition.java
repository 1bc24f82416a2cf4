package com.eyelevel.dispatcher.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * A registered analysis service. Services are external workers; this record only describes
 * which files they accept and where they run in the stage order.
 */
@Entity
@Table(name = "service_definition")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceDefinition {

    @Id
    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String category;

    @Column(nullable = false)
    private String stage;

    /**
     * File-type pattern, matched against the whole type. An empty pattern matches nothing.
     */
    private String accepts;

    private String rejects;

    @Builder.Default
    @Column(nullable = false)
    private int failureLimit = 5;

    @Builder.Default
    @Column(nullable = false)
    private String version = "0";

    /**
     * Default service parameters as a JSON object.
     */
    @Column(columnDefinition = "TEXT")
    private String config;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
