package ai.bundlewatch.backend.model.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One instance of monitoring a bundle for one patient encounter.
 * Re-triggering the same bundle for the same encounter updates this row, never duplicates it.
 */
@Entity
@Table(name = "episode",
        uniqueConstraints = @UniqueConstraint(name = "uk_episode_identity",
                columnNames = {"patient_id", "encounter_id", "bundle_id"}))
public class Episode {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "patient_id", nullable = false)
    private String patientId;

    @Column(name = "encounter_id", nullable = false)
    private String encounterId;

    @Column(name = "bundle_id", nullable = false)
    private String bundleId;

    @Column(name = "trigger_time", nullable = false)
    private Instant triggerTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private EpisodeStatus status = EpisodeStatus.ACTIVE;

    @Column(name = "age_days")
    private Integer ageDays;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    // Getters and setters

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getPatientId() { return patientId; }
    public void setPatientId(String patientId) { this.patientId = patientId; }

    public String getEncounterId() { return encounterId; }
    public void setEncounterId(String encounterId) { this.encounterId = encounterId; }

    public String getBundleId() { return bundleId; }
    public void setBundleId(String bundleId) { this.bundleId = bundleId; }

    public Instant getTriggerTime() { return triggerTime; }
    public void setTriggerTime(Instant triggerTime) { this.triggerTime = triggerTime; }

    public EpisodeStatus getStatus() { return status; }
    public void setStatus(EpisodeStatus status) { this.status = status; }

    public Integer getAgeDays() { return ageDays; }
    public void setAgeDays(Integer ageDays) { this.ageDays = ageDays; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
