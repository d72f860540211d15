package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.BusinessSetting;
import com.retail.billkeeper.model.SettingKey;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BusinessSettingRepository extends JpaRepository<BusinessSetting, SettingKey> {
}
