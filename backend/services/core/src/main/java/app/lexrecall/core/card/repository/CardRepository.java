package app.lexrecall.core.card.repository;

import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.card.entity.CardEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface CardRepository extends JpaRepository<CardEntity, UUID> {

    @Query("""
        select c from CardEntity c
        where c.dueDate is not null
          and c.dueDate <= :beforeDate
          and (:includeArchived = true or c.archived = false)
          and (:subject is null or c.subject = :subject)
          and (:topic is null or c.topic = :topic)
        order by c.dueDate asc, c.createdAt asc, c.cardId asc
        """)
    List<CardEntity> findDue(@Param("beforeDate") LocalDate beforeDate,
                             @Param("subject") Subject subject,
                             @Param("topic") Topic topic,
                             @Param("includeArchived") boolean includeArchived);

    @Query("""
        select c from CardEntity c
        where c.dueDate is null
          and c.lastReviewedAt is null
          and (:includeArchived = true or c.archived = false)
          and (:subject is null or c.subject = :subject)
          and (:topic is null or c.topic = :topic)
        order by c.createdAt asc, c.cardId asc
        """)
    List<CardEntity> findNew(@Param("subject") Subject subject,
                             @Param("topic") Topic topic,
                             @Param("includeArchived") boolean includeArchived);

    @Query("""
        select c from CardEntity c
        where (:includeArchived = true or c.archived = false)
          and (:subject is null or c.subject = :subject)
          and (:topic is null or c.topic = :topic)
        order by c.createdAt asc, c.cardId asc
        """)
    List<CardEntity> findFiltered(@Param("subject") Subject subject,
                                  @Param("topic") Topic topic,
                                  @Param("includeArchived") boolean includeArchived);
}
