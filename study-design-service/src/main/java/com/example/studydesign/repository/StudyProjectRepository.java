package com.example.studydesign.repository;

import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.entity.StudyProject;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for StudyProject entity.
 */
@Repository
public interface StudyProjectRepository extends JpaRepository<StudyProject, UUID> {

    /**
     * Projects in one of the given statuses that have not been touched since {@code before}.
     */
    @Query("SELECT p.id FROM StudyProject p WHERE p.status IN :statuses " +
            "AND p.updatedAt < :before ORDER BY p.updatedAt ASC")
    List<UUID> findIdsByStatusInAndUpdatedAtBefore(@Param("statuses") Collection<ProjectStatus> statuses,
                                                   @Param("before") Instant before);
}
