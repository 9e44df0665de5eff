package com.example.truingup.repository;

import com.example.truingup.entity.AuditTrail;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AuditTrailRepository extends JpaRepository<AuditTrail, Long> {

    Optional<AuditTrail> findByChecksum(String checksum);
}
