package io.b2mash.maxify.metric;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MetricRepository extends JpaRepository<Metric, UUID> {

  List<Metric> findByProjectIdInOrderBySortOrder(Collection<UUID> projectIds);

  @Query("SELECT m.id FROM Metric m WHERE m.projectId IN :projectIds")
  List<UUID> findIdsByProjectIdIn(@Param("projectIds") Collection<UUID> projectIds);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM Metric m WHERE m.projectId IN :projectIds")
  int deleteByProjectIdIn(@Param("projectIds") Collection<UUID> projectIds);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM Metric m WHERE m.id = :id")
  int deleteOneById(@Param("id") UUID id);
}
