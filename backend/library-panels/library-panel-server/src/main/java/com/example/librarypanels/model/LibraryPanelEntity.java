package com.example.librarypanels.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * LibraryPanel database entity - internal persistence model. Used for JDBC (PostgreSQL)
 * persistence. The model column holds the panel JSON exactly as the caller sent it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("library_panel")
public class LibraryPanelEntity {

  @Id private Long id;
  private Long orgId;
  private Long folderId;
  private String uid;
  private String name;
  private String model;
  private LocalDateTime created;
  private LocalDateTime updated;
  private Long createdBy;
  private Long updatedBy;
}
