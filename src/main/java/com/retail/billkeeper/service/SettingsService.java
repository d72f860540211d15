package com.retail.billkeeper.service;

import com.retail.billkeeper.dto.CompanyProfile;
import com.retail.billkeeper.model.BusinessSetting;
import com.retail.billkeeper.model.SettingKey;
import com.retail.billkeeper.repository.BusinessSettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;

@Service
public class SettingsService {

    private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);

    private final BusinessSettingRepository settingRepository;

    public SettingsService(BusinessSettingRepository settingRepository) {
        this.settingRepository = settingRepository;
    }

    @Transactional(readOnly = true)
    public String get(SettingKey key) {
        return settingRepository.findById(key)
                .map(BusinessSetting::getValue)
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public CompanyProfile getCompanyProfile() {
        Map<SettingKey, String> values = new EnumMap<>(SettingKey.class);
        settingRepository.findAll().forEach(setting -> values.put(setting.getKey(), setting.getValue()));
        return new CompanyProfile(
                values.get(SettingKey.COMPANY_NAME),
                values.get(SettingKey.COMPANY_PHONE),
                values.get(SettingKey.COMPANY_ADDRESS),
                values.get(SettingKey.COMPANY_TAX_ID));
    }

    /**
     * Stores the trimmed value. A null or blank value removes the setting, so
     * printed documents fall back to "N/A".
     */
    @Transactional
    public void update(SettingKey key, String value) {
        String trimmed = value != null ? value.trim() : "";
        if (trimmed.isEmpty()) {
            settingRepository.deleteById(key);
            logger.info("Cleared setting {}", key);
            return;
        }
        if (trimmed.length() > key.getMaxLength()) {
            throw new IllegalArgumentException(key + " must be at most " + key.getMaxLength() + " characters");
        }
        BusinessSetting setting = settingRepository.findById(key)
                .orElseGet(() -> new BusinessSetting(key, trimmed));
        setting.setValue(trimmed);
        settingRepository.save(setting);
        logger.info("Updated setting {}", key);
    }

    /**
     * Applies every non-null field of the profile; the others keep their
     * current value.
     */
    @Transactional
    public CompanyProfile updateCompanyProfile(CompanyProfile profile) {
        updateIfPresent(SettingKey.COMPANY_NAME, profile.name());
        updateIfPresent(SettingKey.COMPANY_PHONE, profile.phone());
        updateIfPresent(SettingKey.COMPANY_ADDRESS, profile.address());
        updateIfPresent(SettingKey.COMPANY_TAX_ID, profile.taxId());
        return getCompanyProfile();
    }

    private void updateIfPresent(SettingKey key, String value) {
        if (value != null) {
            update(key, value);
        }
    }
}
