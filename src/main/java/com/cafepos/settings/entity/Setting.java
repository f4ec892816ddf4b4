package com.cafepos.settings.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

@Entity
@Table(name = "settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Setting {

    @Id
    @Column(name = "setting_key", length = 100)
    private String key;

    // Raw JSON document, validated before it is written
    @Column(name = "setting_value", nullable = false, columnDefinition = "TEXT")
    private String value;

    private String description;

    private Long updatedBy;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Setting(String key, String value, String description, Long updatedBy) {
        this.key = key;
        this.value = value;
        this.description = description;
        this.updatedBy = updatedBy;
    }

    public void update(String value, Long updatedBy) {
        this.value = value;
        this.updatedBy = updatedBy;
    }
}
