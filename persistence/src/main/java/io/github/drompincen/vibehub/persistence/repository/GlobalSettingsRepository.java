package io.github.drompincen.vibehub.persistence.repository;

import io.github.drompincen.vibehub.persistence.document.GlobalSettingsDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface GlobalSettingsRepository extends MongoRepository<GlobalSettingsDocument, String> {
}
