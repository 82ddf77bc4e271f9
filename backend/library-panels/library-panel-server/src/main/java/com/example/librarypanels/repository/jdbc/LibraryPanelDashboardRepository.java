package com.example.librarypanels.repository.jdbc;

import com.example.librarypanels.model.LibraryPanelDashboardEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface LibraryPanelDashboardRepository
    extends CrudRepository<LibraryPanelDashboardEntity, Long> {

  @Query("SELECT dashboard_id FROM library_panel_dashboard WHERE library_panel_id = :libraryPanelId")
  List<Long> findDashboardIdsByLibraryPanelId(Long libraryPanelId);

  @Modifying
  @Query(
      "DELETE FROM library_panel_dashboard"
          + " WHERE library_panel_id = :libraryPanelId AND dashboard_id = :dashboardId")
  int deleteByLibraryPanelIdAndDashboardId(Long libraryPanelId, Long dashboardId);
}
