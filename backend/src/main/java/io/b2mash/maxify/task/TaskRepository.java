package io.b2mash.maxify.task;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  List<Task> findByProjectIdIn(Collection<UUID> projectIds);

  @Query("SELECT t.id FROM Task t WHERE t.projectId IN :projectIds")
  List<UUID> findIdsByProjectIdIn(@Param("projectIds") Collection<UUID> projectIds);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM Task t WHERE t.projectId IN :projectIds")
  int deleteByProjectIdIn(@Param("projectIds") Collection<UUID> projectIds);
}
