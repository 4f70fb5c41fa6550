package com.jreinhal.haven.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.haven.casework.CaseRecord;
import com.jreinhal.haven.casework.IncidentType;
import com.jreinhal.haven.casework.Urgency;
import com.jreinhal.haven.model.Notification;
import com.jreinhal.haven.repository.NotificationRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class NotificationServiceTest {

    private NotificationRepository notificationRepository;
    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationRepository = mock(NotificationRepository.class);
        notificationService = new NotificationService(notificationRepository);
        when(notificationRepository.save(any(Notification.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Notification owned(String id, String recipientId) {
        Notification notification = new Notification(recipientId, Notification.Category.REPORT_UPDATED, "t", "m", "r1");
        notification.setId(id);
        when(notificationRepository.findById(id)).thenReturn(Optional.of(notification));
        return notification;
    }

    @Test
    @DisplayName("Urgent reports notify every recipient once")
    void urgentFanOut() {
        CaseRecord record = new CaseRecord();
        record.setId("r1");
        record.setIncidentType(IncidentType.VIOLENCE);
        record.setUrgency(Urgency.CRITICAL);

        notificationService.urgentCaseReported(record, List.of("dir-1", "dir-2"));

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository, times(2)).save(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(Notification::getRecipientId)
                .containsExactly("dir-1", "dir-2");
        assertThat(captor.getAllValues())
                .allSatisfy(n -> {
                    assertThat(n.getCategory()).isEqualTo(Notification.Category.URGENT_REPORT);
                    assertThat(n.getReportId()).isEqualTo("r1");
                    assertThat(n.isRead()).isFalse();
                });
    }

    @Test
    void markReadOnlyWritesWhenUnread() {
        Notification notification = owned("n1", "user-1");

        assertThat(notificationService.markRead("n1", "user-1").isRead()).isTrue();
        notificationService.markRead("n1", "user-1");

        verify(notificationRepository, times(1)).save(notification);
    }

    @Test
    @DisplayName("Another user's notification is reported as not found")
    void foreignNotificationIsHidden() {
        owned("n1", "user-1");

        assertThatThrownBy(() -> notificationService.delete("n1", "user-2"))
                .hasMessage("Notification not found");
        verify(notificationRepository, never()).delete(any());
    }

    @Test
    void markAllReadReturnsCount() {
        Notification a = new Notification("user-1", Notification.Category.REPORT_ASSIGNED, "a", "a", null);
        Notification b = new Notification("user-1", Notification.Category.DOCUMENT_UPLOADED, "b", "b", null);
        when(notificationRepository.findByRecipientIdAndReadFalse("user-1")).thenReturn(List.of(a, b));

        assertThat(notificationService.markAllRead("user-1")).isEqualTo(2);
        assertThat(a.isRead()).isTrue();
        assertThat(b.isRead()).isTrue();
    }

    @Test
    void unreadOnlyUsesUnreadQuery() {
        notificationService.list("user-1", true);

        verify(notificationRepository).findByRecipientIdAndReadFalseOrderByCreatedAtDesc(any(), any());
        verify(notificationRepository, never()).findByRecipientIdOrderByCreatedAtDesc(any(), any());
    }
}
