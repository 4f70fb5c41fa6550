package com.jreinhal.haven.repository;

import com.jreinhal.haven.casework.CaseRecord;
import com.jreinhal.haven.casework.CaseStatus;
import com.jreinhal.haven.casework.IncidentType;
import com.jreinhal.haven.casework.Urgency;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CaseRecordRepository extends MongoRepository<CaseRecord, String> {

    boolean existsByVillageId(String villageId);

    long countByStatus(CaseStatus status);

    long countByIncidentType(IncidentType incidentType);

    long countByUrgency(Urgency urgency);
}
