package com.jreinhal.haven.repository;

import com.jreinhal.haven.casework.CaseDocument;
import com.jreinhal.haven.casework.DocumentType;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CaseDocumentRepository extends MongoRepository<CaseDocument, String> {

    List<CaseDocument> findByReportIdOrderByCreatedAtDesc(String reportId);

    List<CaseDocument> findByReportIdOrderByCreatedAtAsc(String reportId);

    /**
     * Closure gate: does a document of this kind exist for the report.
     */
    boolean existsByReportIdAndType(String reportId, DocumentType type);

    void deleteByReportId(String reportId);
}
