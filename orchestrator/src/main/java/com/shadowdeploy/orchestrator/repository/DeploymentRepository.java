package com.shadowdeploy.orchestrator.repository;

import com.shadowdeploy.orchestrator.model.Deployment;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * History store for terminal deployments.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface DeploymentRepository extends JpaRepository<Deployment, String> {

    /** Most recent deployments first; the page size is the "last N" limit. */
    List<Deployment> findAllByOrderByStartedAtDesc(Pageable page);
}
