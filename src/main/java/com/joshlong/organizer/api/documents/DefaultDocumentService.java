package com.joshlong.organizer.api.documents;

import com.joshlong.organizer.api.folders.FolderIndex;
import com.joshlong.organizer.api.folders.FolderSummary;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

@Service
class DefaultDocumentService implements DocumentService {

	static final String ID_PREFIX = "doc_";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	private final Map<String, Document> documents = new LinkedHashMap<>();

	private final AtomicLong nextId = new AtomicLong(1);

	private final FolderIndex folderIndex;

	private final ApplicationEventPublisher publisher;

	private final Clock clock;

	DefaultDocumentService(FolderIndex folderIndex, ApplicationEventPublisher publisher, Clock clock) {
		this.folderIndex = folderIndex;
		this.publisher = publisher;
		this.clock = clock;
	}

	@Override
	public Document addDocument(String title, String body, @Nullable List<String> tags, @Nullable String folderPath) {
		Assert.notNull(title, "the title must not be null");
		Assert.notNull(body, "the body must not be null");
		checkTags(tags);
		var path = FolderIndex.normalize(folderPath == null ? FolderIndex.ROOT_PATH : folderPath);
		return this.write(() -> {
			var now = this.now();
			var document = new Document(ID_PREFIX + this.nextId.getAndIncrement(), title, body, tags, now, now, path);
			this.documents.put(document.id(), document);
			this.folderIndex.addFolder(path);
			this.folderIndex.addDocumentToFolder(path, document.id());
			this.log.info("created document {} in {}", document.id(), path);
			this.publisher.publishEvent(new DocumentCreatedEvent(document));
			return document;
		});
	}

	@Override
	public Optional<Document> getDocument(String id) {
		return this.write(() -> {
			var document = this.documents.get(id);
			if (document == null)
				return Optional.empty();
			var accessed = document.withLastAccessed(this.now());
			this.documents.put(id, accessed);
			this.publisher.publishEvent(new DocumentAccessedEvent(id));
			return Optional.of(accessed);
		});
	}

	@Override
	public Optional<Document> updateDocument(String id, @Nullable String title, @Nullable String body,
			@Nullable List<String> tags) {
		checkTags(tags);
		return this.write(() -> {
			var document = this.documents.get(id);
			if (document == null)
				return Optional.empty();
			var updated = document.withContent(title != null ? title : document.title(),
					body != null ? body : document.body(), tags != null ? tags : document.tags());
			this.documents.put(id, updated);
			this.log.info("updated document {}", id);
			this.publisher.publishEvent(new DocumentUpdatedEvent(updated));
			return Optional.of(updated);
		});
	}

	@Override
	public boolean deleteDocument(String id) {
		return this.write(() -> {
			var document = this.documents.remove(id);
			if (document == null)
				return false;
			this.folderIndex.removeDocumentFromFolder(document.folderPath(), id);
			this.log.info("deleted document {}", id);
			this.publisher.publishEvent(new DocumentDeletedEvent(id));
			return true;
		});
	}

	@Override
	public boolean moveDocument(String id, String folderPath) {
		Assert.notNull(folderPath, "the folderPath must not be null");
		return this.write(() -> this.doMove(id, FolderIndex.normalize(folderPath)));
	}

	@Override
	public Collection<Document> listDocuments(@Nullable String folderPath) {
		return this.read(() -> {
			if (folderPath == null)
				return List.copyOf(this.documents.values());
			var ids = this.folderIndex.documentsInFolder(folderPath);
			var result = new ArrayList<Document>();
			for (var document : this.documents.values())
				if (ids.contains(document.id()))
					result.add(document);
			return result;
		});
	}

	@Override
	public FolderSummary createFolder(String path) {
		Assert.notNull(path, "the path must not be null");
		return this.write(() -> this.folderIndex.addFolder(path).summary());
	}

	@Override
	public Optional<FolderSummary> folder(String path) {
		return this.folderIndex.describeFolder(path);
	}

	@Override
	public boolean deleteFolder(String path) {
		Assert.notNull(path, "the path must not be null");
		var normalized = FolderIndex.normalize(path);
		if (FolderIndex.ROOT_PATH.equals(normalized))
			return false;
		return this.write(() -> {
			var folder = this.folderIndex.getFolder(normalized);
			if (folder.isEmpty())
				return false;
			var parent = folder.get().parent();
			var parentPath = parent == null ? FolderIndex.ROOT_PATH : parent.path();
			var relocated = 0;
			for (var id : this.folderIndex.documentsInSubtree(normalized))
				if (this.doMove(id, parentPath))
					relocated += 1;
			var deleted = this.folderIndex.deleteFolder(normalized);
			this.log.info("deleted folder {}, moving {} document(s) to {}", normalized, relocated, parentPath);
			return deleted;
		});
	}

	@Override
	public List<FolderSummary> listFolders() {
		return this.folderIndex.traverseDepthFirst();
	}

	private boolean doMove(String id, String path) {
		var document = this.documents.get(id);
		if (document == null)
			return false;
		this.folderIndex.removeDocumentFromFolder(document.folderPath(), id);
		this.folderIndex.addFolder(path);
		this.folderIndex.addDocumentToFolder(path, id);
		this.documents.put(id, document.withFolderPath(path));
		this.log.debug("moved document {} from {} to {}", id, document.folderPath(), path);
		return true;
	}

	private static void checkTags(@Nullable List<String> tags) {
		if (tags != null)
			Assert.noNullElements(tags, "the tags must not contain null elements");
	}

	private OffsetDateTime now() {
		return OffsetDateTime.now(this.clock);
	}

	private <T> T read(Supplier<T> supplier) {
		this.lock.readLock().lock();
		try {
			return supplier.get();
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	private <T> T write(Supplier<T> supplier) {
		this.lock.writeLock().lock();
		try {
			return supplier.get();
		}
		finally {
			this.lock.writeLock().unlock();
		}
	}

}
