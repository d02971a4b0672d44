package com.flamingo.ai.embellisher.domain.repository;

import com.flamingo.ai.embellisher.domain.entity.DriveConnection;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for per-user drive connections. */
@Repository
public interface DriveConnectionRepository extends JpaRepository<DriveConnection, String> {

  Optional<DriveConnection> findByPendingState(String pendingState);
}
