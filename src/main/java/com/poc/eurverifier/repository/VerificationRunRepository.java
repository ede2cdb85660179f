package com.poc.eurverifier.repository;

import com.poc.eurverifier.entity.VerificationRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface VerificationRunRepository extends JpaRepository<VerificationRun, Long> {
    List<VerificationRun> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
}
