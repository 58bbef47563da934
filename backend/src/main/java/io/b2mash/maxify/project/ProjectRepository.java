package io.b2mash.maxify.project;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  Optional<Project> findByNameAndOrganization(String name, String organization);

  Optional<Project> findByNameAndOrganizationIsNull(String name);

  /** Finds a project by its stored (lowercase) organization and name. */
  default Optional<Project> findByQualifiedName(String organization, String name) {
    return organization == null
        ? findByNameAndOrganizationIsNull(name)
        : findByNameAndOrganization(name, organization);
  }

  @Query("SELECT p FROM Project p ORDER BY p.organization ASC NULLS FIRST, p.name ASC")
  List<Project> findAllOrdered();

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM Project p WHERE p.id IN :ids")
  int deleteByIdIn(@Param("ids") Collection<UUID> ids);
}
