package com.example.librarypanels.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Connection between a library panel and a dashboard - internal persistence model. At most one
 * row exists per (libraryPanelId, dashboardId).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table("library_panel_dashboard")
public class LibraryPanelDashboardEntity {

  @Id private Long id;
  private Long libraryPanelId;
  private Long dashboardId;
  private LocalDateTime created;
  private Long createdBy;

  /** Constructor for creating new connections without an ID. */
  public LibraryPanelDashboardEntity(Long libraryPanelId, Long dashboardId, LocalDateTime created, Long createdBy) {
    this.libraryPanelId = libraryPanelId;
    this.dashboardId = dashboardId;
    this.created = created;
    this.createdBy = createdBy;
  }
}
