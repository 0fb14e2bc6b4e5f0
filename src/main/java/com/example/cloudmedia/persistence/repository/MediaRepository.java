package com.example.cloudmedia.persistence.repository;

import com.example.cloudmedia.model.MediaCategory;
import com.example.cloudmedia.persistence.document.MediaDocument;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface MediaRepository extends MongoRepository<MediaDocument, String> {

    Page<MediaDocument> findByOwnerId(String ownerId, Pageable pageable);

    Page<MediaDocument> findByOwnerIdAndMediaType(String ownerId, MediaCategory mediaType, Pageable pageable);

    long deleteByIdAndOwnerId(String id, String ownerId);
}
