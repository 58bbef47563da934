package io.b2mash.maxify.task;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DataPointRepository extends JpaRepository<DataPoint, DataPointId> {

  List<DataPoint> findByTaskIdIn(Collection<UUID> taskIds);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM DataPoint dp WHERE dp.taskId IN :taskIds")
  int deleteByTaskIdIn(@Param("taskIds") Collection<UUID> taskIds);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM DataPoint dp WHERE dp.metricId IN :metricIds")
  int deleteByMetricIdIn(@Param("metricIds") Collection<UUID> metricIds);
}
