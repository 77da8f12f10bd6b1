package com.example.chatrelay.repo;

import com.example.chatrelay.model.StreamCheckpoint;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface StreamCheckpointRepo extends MongoRepository<StreamCheckpoint, String> {
}
