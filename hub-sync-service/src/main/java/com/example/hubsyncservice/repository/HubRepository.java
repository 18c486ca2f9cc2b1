package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.Hub;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface HubRepository extends JpaRepository<Hub, UUID> {

    boolean existsBySlug(String slug);

    List<Hub> findAllByOrderByNameAsc();
}
