package com.openshaz.worker.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PreUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Columns shared by both feature tables. The id is assigned by the caller, never generated.
 */
@MappedSuperclass
public abstract class AudioFeatures {

    @Id
    @Column(name = "id", nullable = false)
    private Integer id;

    @Column(name = "name", nullable = false, length = 255)
    private String name; // file name as uploaded: "00042_blues.wav"

    @Column(name = "bucket_url", nullable = false, length = 500)
    private String bucketUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "features", nullable = false, columnDefinition = "jsonb")
    private List<Double> features = new ArrayList<>();

    // Timestamps
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    protected AudioFeatures() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    protected AudioFeatures(Integer id, String name, String bucketUrl, List<Double> features) {
        this();
        this.id = id;
        this.name = name;
        this.bucketUrl = bucketUrl;
        this.features = new ArrayList<>(features);
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public double[] featureArray() {
        double[] out = new double[features.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = features.get(i);
        }
        return out;
    }

    // Getters and Setters
    public Integer getId() {
        return id;
    }

    public void setId(Integer id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getBucketUrl() {
        return bucketUrl;
    }

    public void setBucketUrl(String bucketUrl) {
        this.bucketUrl = bucketUrl;
    }

    public List<Double> getFeatures() {
        return features;
    }

    public void setFeatures(List<Double> features) {
        this.features = features;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", dimensions=" + (features == null ? 0 : features.size()) +
                ", createdAt=" + createdAt +
                '}';
    }
}
