package com.retail.billkeeper.config;

import com.retail.billkeeper.model.Party;
import com.retail.billkeeper.model.SettingKey;
import com.retail.billkeeper.repository.PartyRepository;
import com.retail.billkeeper.service.SettingsService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataInitializer {

    public static final String WALK_IN_PARTY = "Walk-in Customer";

    @Bean
    CommandLineRunner init(PartyRepository partyRepo, SettingsService settingsService,
            @Value("${billkeeper.company.name:My Business}") String defaultCompanyName) {
        return args -> {
            // Ensure Walk-in party exists for counter sales
            if (partyRepo.findByName(WALK_IN_PARTY).isEmpty()) {
                Party walkIn = new Party();
                walkIn.setName(WALK_IN_PARTY);
                walkIn.setAddress("N/A");
                partyRepo.save(walkIn);
            }

            if (settingsService.get(SettingKey.COMPANY_NAME) == null) {
                settingsService.update(SettingKey.COMPANY_NAME, defaultCompanyName);
            }
        };
    }
}
