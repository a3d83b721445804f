package com.esgledger.governance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GovernanceSettingsRepository extends JpaRepository<GovernanceSettings, String> {
}
