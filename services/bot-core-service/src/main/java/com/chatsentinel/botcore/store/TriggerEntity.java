package com.chatsentinel.botcore.store;

import com.chatsentinel.botcore.trigger.MatchKind;
import com.chatsentinel.botcore.trigger.TriggerRule;
import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

@Entity
@Table(name = "triggers")
public class TriggerEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "keyword", nullable = false, unique = true, length = 512)
  private String keyword;

  @Column(name = "response", nullable = false, columnDefinition = "text")
  private String response;

  @Column(name = "match_kind", nullable = false, length = 16)
  private String matchKind;

  @Column(name = "case_sensitive", nullable = false)
  private boolean caseSensitive;

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TriggerEntity() {}

  public TriggerEntity(
      String keyword, String response, MatchKind matchKind, boolean caseSensitive) {
    this.keyword = keyword;
    this.response = response;
    this.matchKind = matchKind.code();
    this.caseSensitive = caseSensitive;
    this.active = true;
  }

  @PrePersist
  public void prePersist() {
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  public void preUpdate() {
    updatedAt = Instant.now();
  }

  public TriggerRule toRule() {
    return new TriggerRule(keyword, response, MatchKind.fromCode(matchKind), caseSensitive, active);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    TriggerEntity that = (TriggerEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
