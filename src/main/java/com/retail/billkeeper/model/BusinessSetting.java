package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "business_settings")
@Data
@NoArgsConstructor
public class BusinessSetting {
    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "setting_key", length = 64)
    private SettingKey key;

    @Column(name = "setting_value", nullable = false, length = 500)
    private String value;

    private LocalDateTime updatedAt;

    public BusinessSetting(SettingKey key, String value) {
        this.key = key;
        this.value = value;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
