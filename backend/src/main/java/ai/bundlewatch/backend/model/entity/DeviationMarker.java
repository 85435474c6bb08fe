package ai.bundlewatch.backend.model.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable record that a deviation alert was emitted for an (episode, element) pair.
 */
@Entity
@Table(name = "deviation_marker",
        uniqueConstraints = @UniqueConstraint(name = "uk_deviation_marker_episode_element",
                columnNames = {"episode_id", "element_id"}))
public class DeviationMarker {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "episode_id", nullable = false)
    private UUID episodeId;

    @Column(name = "element_id", nullable = false)
    private String elementId;

    @Column(name = "alert_id")
    private String alertId;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getEpisodeId() { return episodeId; }
    public void setEpisodeId(UUID episodeId) { this.episodeId = episodeId; }

    public String getElementId() { return elementId; }
    public void setElementId(String elementId) { this.elementId = elementId; }

    public String getAlertId() { return alertId; }
    public void setAlertId(String alertId) { this.alertId = alertId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
