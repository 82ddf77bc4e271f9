package com.example.librarypanels.repository.jdbc;

import com.example.librarypanels.model.LibraryPanelEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.time.LocalDateTime;
import java.util.List;

public interface LibraryPanelRepository extends CrudRepository<LibraryPanelEntity, Long> {

  @Query("SELECT * FROM library_panel WHERE uid = :uid AND org_id = :orgId")
  List<LibraryPanelEntity> findAllByUidAndOrgId(String uid, Long orgId);

  @Query("SELECT * FROM library_panel WHERE org_id = :orgId")
  List<LibraryPanelEntity> findAllByOrgId(Long orgId);

  @Modifying
  @Query(
      "UPDATE library_panel SET folder_id = :folderId, name = :name, model = :model,"
          + " updated = :updated, updated_by = :updatedBy WHERE id = :id AND org_id = :orgId")
  int updateContent(
      Long id,
      Long orgId,
      Long folderId,
      String name,
      String model,
      LocalDateTime updated,
      Long updatedBy);

  @Modifying
  @Query("DELETE FROM library_panel WHERE uid = :uid AND org_id = :orgId")
  int deleteByUidAndOrgId(String uid, Long orgId);
}
