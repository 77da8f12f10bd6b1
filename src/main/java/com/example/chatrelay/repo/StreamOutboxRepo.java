package com.example.chatrelay.repo;

import com.example.chatrelay.model.StreamOutboxEntry;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface StreamOutboxRepo extends MongoRepository<StreamOutboxEntry, String> {
    List<StreamOutboxEntry> findTop50ByProcessedFalseAndDeadFalseOrderByEnqueuedAtAscPositionAsc();
    boolean existsByProcessedFalseAndDeadFalse();
}
