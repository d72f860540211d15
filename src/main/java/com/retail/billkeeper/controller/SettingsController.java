package com.retail.billkeeper.controller;

import com.retail.billkeeper.dto.CompanyProfile;
import com.retail.billkeeper.service.SettingsService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping("/company")
    public CompanyProfile company() {
        return settingsService.getCompanyProfile();
    }

    @PutMapping("/company")
    public CompanyProfile updateCompany(@Valid @RequestBody CompanyProfile profile) {
        return settingsService.updateCompanyProfile(profile);
    }
}
