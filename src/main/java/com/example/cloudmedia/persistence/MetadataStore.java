package com.example.cloudmedia.persistence;

import com.example.cloudmedia.model.MediaCategory;
import com.example.cloudmedia.persistence.document.MediaDocument;
import com.example.cloudmedia.persistence.document.UserDocument;

import java.util.List;
import java.util.Optional;

public interface MetadataStore {

    CreateResult<UserDocument> createUser(UserDocument user);

    Optional<UserDocument> findUserById(String id);

    Optional<UserDocument> findUserByEmail(String email);

    List<UserDocument> findAllUsers();

    Optional<UserDocument> updateUserPasswordHash(String id, String passwordHash);

    CreateResult<MediaDocument> createMedia(MediaDocument media);

    /**
     * Looks a record up by id. {@code ownerId} is the partition hint; stores without partitions may ignore it,
     * so callers must still compare the returned owner with the caller.
     */
    Optional<MediaDocument> findMedia(String id, String ownerId);

    PageSlice<MediaDocument> listMedia(String ownerId, int page, int pageSize, MediaCategory mediaType);

    PageSlice<MediaDocument> searchMedia(String ownerId, String query, int page, int pageSize);

    Optional<MediaDocument> updateMedia(String id, String ownerId, MediaPatch patch);

    boolean deleteMedia(String id, String ownerId);
}
