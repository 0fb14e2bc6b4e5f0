package com.example.cloudmedia.persistence;

import com.example.cloudmedia.exception.BackendUnavailableException;
import com.example.cloudmedia.model.MediaCategory;
import com.example.cloudmedia.persistence.document.MediaDocument;
import com.example.cloudmedia.persistence.document.UserDocument;
import com.example.cloudmedia.persistence.repository.MediaRepository;
import com.example.cloudmedia.persistence.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
public class MongoMetadataStore implements MetadataStore {

    private static final Logger log = LoggerFactory.getLogger(MongoMetadataStore.class);

    static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "uploadedAt")
        .and(Sort.by(Sort.Direction.DESC, "id"));

    private final UserRepository userRepository;
    private final MediaRepository mediaRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public CreateResult<UserDocument> createUser(UserDocument user) {
        return insert("create user", () -> userRepository.insert(user));
    }

    @Override
    public Optional<UserDocument> findUserById(String id) {
        return guarded("find user by id", () -> userRepository.findById(id));
    }

    @Override
    public Optional<UserDocument> findUserByEmail(String email) {
        return guarded("find user by email", () -> userRepository.findByEmail(email));
    }

    @Override
    public List<UserDocument> findAllUsers() {
        return guarded("list users", userRepository::findAll);
    }

    @Override
    public Optional<UserDocument> updateUserPasswordHash(String id, String passwordHash) {
        Query query = Query.query(Criteria.where("id").is(id));
        Update update = new Update().set("passwordHash", passwordHash);
        return guarded("update user password", () -> Optional.ofNullable(mongoTemplate.findAndModify(
            query, update, FindAndModifyOptions.options().returnNew(true), UserDocument.class)));
    }

    @Override
    public CreateResult<MediaDocument> createMedia(MediaDocument media) {
        return insert("create media", () -> mediaRepository.insert(media));
    }

    @Override
    public Optional<MediaDocument> findMedia(String id, String ownerId) {
        return guarded("find media", () -> mediaRepository.findById(id));
    }

    @Override
    public PageSlice<MediaDocument> listMedia(String ownerId, int page, int pageSize, MediaCategory mediaType) {
        Pageable pageable = PageRequest.of(page - 1, pageSize, NEWEST_FIRST);
        Page<MediaDocument> result = guarded("list media", () -> mediaType == null
            ? mediaRepository.findByOwnerId(ownerId, pageable)
            : mediaRepository.findByOwnerIdAndMediaType(ownerId, mediaType, pageable));
        return new PageSlice<>(result.getContent(), result.getTotalElements());
    }

    @Override
    public PageSlice<MediaDocument> searchMedia(String ownerId, String query, int page, int pageSize) {
        String literal = Pattern.quote(query);
        Criteria criteria = Criteria.where("ownerId").is(ownerId).orOperator(
            Criteria.where("originalName").regex(literal, "i"),
            Criteria.where("description").regex(literal, "i"),
            Criteria.where("tags").regex("^" + literal + "$", "i"));

        return guarded("search media", () -> {
            long total = mongoTemplate.count(Query.query(criteria), MediaDocument.class);
            Query windowed = Query.query(criteria).with(PageRequest.of(page - 1, pageSize, NEWEST_FIRST));
            List<MediaDocument> items = mongoTemplate.find(windowed, MediaDocument.class);
            return new PageSlice<>(items, total);
        });
    }

    @Override
    public Optional<MediaDocument> updateMedia(String id, String ownerId, MediaPatch patch) {
        Query query = Query.query(Criteria.where("id").is(id).and("ownerId").is(ownerId));
        Update update = new Update().set("updatedAt", patch.updatedAt());
        if (patch.hasDescription()) {
            update.set("description", patch.description());
        }
        if (patch.hasTags()) {
            update.set("tags", patch.tags());
        }
        return guarded("update media", () -> Optional.ofNullable(mongoTemplate.findAndModify(
            query, update, FindAndModifyOptions.options().returnNew(true), MediaDocument.class)));
    }

    @Override
    public boolean deleteMedia(String id, String ownerId) {
        return guarded("delete media", () -> mediaRepository.deleteByIdAndOwnerId(id, ownerId) > 0);
    }

    private <T> CreateResult<T> insert(String action, Supplier<T> operation) {
        try {
            return CreateResult.created(operation.get());
        } catch (DuplicateKeyException ex) {
            log.info("Failed to {}: document already exists", action);
            return CreateResult.alreadyExists();
        } catch (DataAccessException ex) {
            log.error("Failed to {}", action, ex);
            throw new BackendUnavailableException("Metadata store failed to " + action, ex);
        }
    }

    private <T> T guarded(String action, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException ex) {
            log.error("Failed to {}", action, ex);
            throw new BackendUnavailableException("Metadata store failed to " + action, ex);
        }
    }
}
