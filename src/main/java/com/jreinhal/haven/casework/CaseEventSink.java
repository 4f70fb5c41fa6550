package com.jreinhal.haven.casework;

import java.util.Collection;

/**
 * Outbound events of the case workflow.
 *
 * Owned by the case engine and implemented by the notification layer, so the engine
 * does not depend on how recipients are told.
 */
public interface CaseEventSink {

    void urgentCaseReported(CaseRecord record, Collection<String> recipientIds);

    void caseAssigned(CaseRecord record, String analystId);

    void caseUpdated(CaseRecord record, String recipientId);

    void caseClassified(CaseRecord record, String recipientId);

    void documentAttached(CaseRecord record, DocumentType type, String recipientId);
}
