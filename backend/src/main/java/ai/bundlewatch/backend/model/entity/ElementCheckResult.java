package ai.bundlewatch.backend.model.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of checking one bundle element for one episode. Mutated in place across cycles
 * until it reaches a terminal status.
 */
@Entity
@Table(name = "element_result",
        uniqueConstraints = @UniqueConstraint(name = "uk_element_result_episode_element",
                columnNames = {"episode_id", "element_id"}))
public class ElementCheckResult {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "episode_id", nullable = false)
    private UUID episodeId;

    @Column(name = "element_id", nullable = false)
    private String elementId;

    @Column(name = "element_name")
    private String elementName;

    @Column(name = "required")
    private boolean required;

    @Column(name = "display_order")
    private int displayOrder;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ElementStatus status = ElementStatus.PENDING;

    @Column(name = "time_window_hours")
    private Double timeWindowHours;

    @Column(name = "deadline")
    private Instant deadline;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "value_text")
    private String value;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Getters and setters

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getEpisodeId() { return episodeId; }
    public void setEpisodeId(UUID episodeId) { this.episodeId = episodeId; }

    public String getElementId() { return elementId; }
    public void setElementId(String elementId) { this.elementId = elementId; }

    public String getElementName() { return elementName; }
    public void setElementName(String elementName) { this.elementName = elementName; }

    public boolean isRequired() { return required; }
    public void setRequired(boolean required) { this.required = required; }

    public int getDisplayOrder() { return displayOrder; }
    public void setDisplayOrder(int displayOrder) { this.displayOrder = displayOrder; }

    public ElementStatus getStatus() { return status; }
    public void setStatus(ElementStatus status) { this.status = status; }

    public Double getTimeWindowHours() { return timeWindowHours; }
    public void setTimeWindowHours(Double timeWindowHours) { this.timeWindowHours = timeWindowHours; }

    public Instant getDeadline() { return deadline; }
    public void setDeadline(Instant deadline) { this.deadline = deadline; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /**
     * Parses the recorded value as a number, used by dependent elements.
     *
     * @return the numeric value, or null when absent or not numeric
     */
    public Double numericValue() {
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
