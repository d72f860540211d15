package com.retail.billkeeper.service;

import com.retail.billkeeper.dto.CompanyProfile;
import com.retail.billkeeper.model.BusinessSetting;
import com.retail.billkeeper.model.SettingKey;
import com.retail.billkeeper.repository.BusinessSettingRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SettingsServiceTest {

    @Mock
    private BusinessSettingRepository settingRepository;

    @InjectMocks
    private SettingsService settingsService;

    @Test
    void getCompanyProfile_ShouldLeaveMissingKeysNull() {
        when(settingRepository.findAll()).thenReturn(List.of(
                new BusinessSetting(SettingKey.COMPANY_NAME, "Sharma Footwear"),
                new BusinessSetting(SettingKey.COMPANY_TAX_ID, "27ABCDE1234F1Z5")));

        CompanyProfile profile = settingsService.getCompanyProfile();

        assertEquals("Sharma Footwear", profile.name());
        assertEquals("27ABCDE1234F1Z5", profile.taxId());
        assertNull(profile.phone());
        assertNull(profile.address());
    }

    @Test
    void update_ShouldTrimAndCreateMissingSetting() {
        when(settingRepository.findById(SettingKey.COMPANY_PHONE)).thenReturn(Optional.empty());
        ArgumentCaptor<BusinessSetting> captor = ArgumentCaptor.forClass(BusinessSetting.class);

        settingsService.update(SettingKey.COMPANY_PHONE, "  98200 12345 ");

        verify(settingRepository).save(captor.capture());
        assertEquals(SettingKey.COMPANY_PHONE, captor.getValue().getKey());
        assertEquals("98200 12345", captor.getValue().getValue());
    }

    @Test
    void update_ShouldOverwriteExistingValue() {
        BusinessSetting existing = new BusinessSetting(SettingKey.COMPANY_NAME, "Old Name");
        when(settingRepository.findById(SettingKey.COMPANY_NAME)).thenReturn(Optional.of(existing));

        settingsService.update(SettingKey.COMPANY_NAME, "New Name");

        assertEquals("New Name", existing.getValue());
        verify(settingRepository).save(existing);
    }

    @Test
    void update_ShouldRemoveSetting_WhenValueIsBlank() {
        settingsService.update(SettingKey.COMPANY_ADDRESS, "   ");

        verify(settingRepository).deleteById(SettingKey.COMPANY_ADDRESS);
        verify(settingRepository, never()).save(any());
    }

    @Test
    void update_ShouldRejectOverlongValue() {
        assertThrows(IllegalArgumentException.class,
                () -> settingsService.update(SettingKey.COMPANY_PHONE, "9".repeat(33)));
        verifyNoInteractions(settingRepository);
    }

    @Test
    void updateCompanyProfile_ShouldOnlyTouchProvidedFields() {
        when(settingRepository.findById(SettingKey.COMPANY_NAME)).thenReturn(Optional.empty());
        when(settingRepository.findAll()).thenReturn(List.of(new BusinessSetting(SettingKey.COMPANY_NAME, "Acme")));

        CompanyProfile result = settingsService.updateCompanyProfile(new CompanyProfile("Acme", null, null, null));

        assertEquals("Acme", result.name());
        verify(settingRepository, times(1)).save(any());
        verify(settingRepository, never()).deleteById(any());
    }
}
