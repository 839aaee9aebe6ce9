package com.flamingo.ai.evomemory.domain.repository;

import com.flamingo.ai.evomemory.domain.entity.MetaNeuron;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for MetaNeuron entities. */
@Repository
public interface MetaNeuronRepository extends JpaRepository<MetaNeuron, Long> {}
