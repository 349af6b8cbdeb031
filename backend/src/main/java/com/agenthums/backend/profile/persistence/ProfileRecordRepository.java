package com.agenthums.backend.profile.persistence;

import com.agenthums.backend.profile.domain.ProfileRecord;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProfileRecordRepository extends JpaRepository<ProfileRecord, UUID> {

  Page<ProfileRecord> findByActiveTrue(Pageable pageable);
}
