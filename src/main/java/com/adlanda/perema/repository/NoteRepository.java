package com.adlanda.perema.repository;

import com.adlanda.perema.entity.Note;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NoteRepository extends JpaRepository<Note, Long> {

    List<Note> findByContact_IdOrderByDateDescIdDesc(Long contactId);
}
