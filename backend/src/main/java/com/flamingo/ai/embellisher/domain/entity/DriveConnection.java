package com.flamingo.ai.embellisher.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Cloud drive credentials and pending OAuth state for one user. */
@Entity
@Table(name = "drive_connections")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriveConnection {

  @Id private String ownerId;

  @Column(columnDefinition = "TEXT")
  private String accessToken;

  @Column(columnDefinition = "TEXT")
  private String refreshToken;

  private Instant expiresAt;

  /** State token of an authorization in flight. */
  @Column(unique = true)
  private String pendingState;

  private Instant stateIssuedAt;

  private LocalDateTime updatedAt;

  @PrePersist
  @PreUpdate
  protected void touch() {
    updatedAt = LocalDateTime.now();
  }

  public boolean isConnected() {
    return accessToken != null || refreshToken != null;
  }

  /** True if the access token is missing or expires within the given skew. */
  public boolean isAccessTokenExpired(Instant now, long skewSeconds) {
    return accessToken == null
        || expiresAt == null
        || expiresAt.minusSeconds(skewSeconds).isBefore(now);
  }
}
