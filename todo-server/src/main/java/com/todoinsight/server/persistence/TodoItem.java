package com.todoinsight.server.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;
import java.util.Objects;

@Entity
@Table(name = "todo_items")
public class TodoItem {

    public static final int MAX_DESCRIPTION_LENGTH = 255;

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "description", nullable = false, length = MAX_DESCRIPTION_LENGTH)
    private String description;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    // insertion order of the collection
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    protected TodoItem() {
        // for JPA
    }

    public TodoItem(String id, String description, LocalDateTime createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.completed = false;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public boolean isCompleted() {
        return completed;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    /**
     * Applies only the fields present in {@code changes}; the id never changes.
     */
    public void apply(ItemChanges changes) {
        if (changes.description() != null) {
            description = changes.description();
        }
        if (changes.completed() != null) {
            completed = changes.completed();
        }
    }
}
