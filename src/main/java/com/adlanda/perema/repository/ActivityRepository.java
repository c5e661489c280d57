package com.adlanda.perema.repository;

import com.adlanda.perema.entity.Activity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ActivityRepository extends JpaRepository<Activity, Long> {

    List<Activity> findByContact_IdOrderByDateDescIdDesc(Long contactId);
}
