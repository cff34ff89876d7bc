package com.chatsentinel.botcore.store;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TriggerRepository extends JpaRepository<TriggerEntity, Long> {

  List<TriggerEntity> findAllByActiveTrueOrderByIdAsc();

  boolean existsByKeyword(String keyword);

  long deleteByKeyword(String keyword);

  long countByActiveTrue();
}
