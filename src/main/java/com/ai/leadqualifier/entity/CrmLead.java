package com.ai.leadqualifier.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "crm_lead", indexes = {
    @Index(name = "idx_crm_lead_phone", columnList = "phone")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CrmLead {

    public static final int NAME_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String phone;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(nullable = false, length = 20)
    private String status;

    @Column(nullable = false, length = 50)
    private String source;

    @Column(nullable = false, length = 10)
    private String priority;

    /** JSON array of tag names. */
    @Column(columnDefinition = "TEXT")
    private String tags;

    /** JSON object with the facts collected during qualification. */
    @Column(name = "custom_fields", columnDefinition = "TEXT")
    private String customFields;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "qualification_score", nullable = false)
    private Integer qualificationScore;

    @Column(name = "qualified_at")
    private Instant qualifiedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
