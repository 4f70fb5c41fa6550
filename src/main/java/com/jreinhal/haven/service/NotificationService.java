package com.jreinhal.haven.service;

import com.jreinhal.haven.casework.CaseEventSink;
import com.jreinhal.haven.casework.CaseRecord;
import com.jreinhal.haven.casework.DocumentType;
import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.model.Notification;
import com.jreinhal.haven.repository.NotificationRepository;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * In-app notifications. Receives case workflow events and exposes the recipient's inbox.
 */
@Service
public class NotificationService implements CaseEventSink {
    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);
    static final int MAX_LIST = 50;
    private final NotificationRepository notificationRepository;

    public NotificationService(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    public Notification notify(String recipientId, Notification.Category category, String title, String message, String reportId) {
        Notification saved = notificationRepository.save(new Notification(recipientId, category, title, message, reportId));
        log.debug("Notification {} queued for {} (report={})", category, recipientId, reportId);
        return saved;
    }

    @Override
    public void urgentCaseReported(CaseRecord record, Collection<String> recipientIds) {
        String title = "Signalement URGENT: " + record.getIncidentType();
        String message = "Un signalement d'urgence " + record.getUrgency() + " a été soumis et nécessite une attention immédiate.";
        for (String recipientId : recipientIds) {
            notify(recipientId, Notification.Category.URGENT_REPORT, title, message, record.getId());
        }
    }

    @Override
    public void caseAssigned(CaseRecord record, String analystId) {
        notify(analystId, Notification.Category.REPORT_ASSIGNED, "Nouveau signalement assigné",
                "Un signalement de type " + record.getIncidentType() + " vous a été assigné.", record.getId());
    }

    @Override
    public void caseUpdated(CaseRecord record, String recipientId) {
        notify(recipientId, Notification.Category.REPORT_UPDATED, "Signalement mis à jour",
                "Un signalement qui vous est assigné a été modifié.", record.getId());
    }

    @Override
    public void caseClassified(CaseRecord record, String recipientId) {
        notify(recipientId, Notification.Category.REPORT_CLASSIFIED, "Signalement classifié",
                "Votre signalement a été classifié: " + record.getStatus() + ".", record.getId());
    }

    @Override
    public void documentAttached(CaseRecord record, DocumentType type, String recipientId) {
        notify(recipientId, Notification.Category.DOCUMENT_UPLOADED, "Nouveau document ajouté",
                "Un document " + type + " a été ajouté au signalement.", record.getId());
    }

    public List<Notification> list(String recipientId, boolean unreadOnly) {
        PageRequest page = PageRequest.of(0, MAX_LIST);
        return unreadOnly
                ? notificationRepository.findByRecipientIdAndReadFalseOrderByCreatedAtDesc(recipientId, page)
                : notificationRepository.findByRecipientIdOrderByCreatedAtDesc(recipientId, page);
    }

    public long unreadCount(String recipientId) {
        return notificationRepository.countByRecipientIdAndReadFalse(recipientId);
    }

    public Notification markRead(String notificationId, String recipientId) {
        Notification notification = requireOwned(notificationId, recipientId);
        if (!notification.isRead()) {
            notification.setRead(true);
            notification = notificationRepository.save(notification);
        }
        return notification;
    }

    public int markAllRead(String recipientId) {
        List<Notification> unread = notificationRepository.findByRecipientIdAndReadFalse(recipientId);
        unread.forEach(n -> n.setRead(true));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    public void delete(String notificationId, String recipientId) {
        notificationRepository.delete(requireOwned(notificationId, recipientId));
    }

    private Notification requireOwned(String notificationId, String recipientId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> HavenException.notFound("Notification not found"));
        // Other users' notifications are reported as absent.
        if (!notification.getRecipientId().equals(recipientId)) {
            throw HavenException.notFound("Notification not found");
        }
        return notification;
    }
}
