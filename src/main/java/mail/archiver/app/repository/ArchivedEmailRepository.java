package mail.archiver.app.repository;

import mail.archiver.app.entity.ArchivedEmail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ArchivedEmailRepository extends JpaRepository<ArchivedEmail, Long> {
    boolean existsByMailAccountIdAndMessageId(Long mailAccountId, String messageId);

    // Fetch with attachments to avoid LazyInitializationException outside the transaction
    @Query("SELECT e FROM ArchivedEmail e LEFT JOIN FETCH e.attachments WHERE e.id = :id")
    Optional<ArchivedEmail> findByIdWithAttachments(@Param("id") Long id);
}
