package com.joshlong.organizer.api.folders;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

class FolderIndexTest {

	private final FolderIndex folders = new FolderIndex();

	@Test
	void normalize() {
		Assertions.assertEquals("/", FolderIndex.normalize("/"));
		Assertions.assertEquals("/", FolderIndex.normalize(""));
		Assertions.assertEquals("/", FolderIndex.normalize("///"));
		Assertions.assertEquals("/work/notes", FolderIndex.normalize("work/notes/"));
		Assertions.assertEquals("/work/notes", FolderIndex.normalize("//work//notes"));
		Assertions.assertEquals("/Work", FolderIndex.normalize("/Work"), "paths are case sensitive");
	}

	@Test
	void addFolderRoundTrips() {
		for (var path : List.of("/a", "a/b/", "/a/b/c", "x//y", "/")) {
			var node = this.folders.addFolder(path);
			Assertions.assertEquals(FolderIndex.normalize(path), node.path());
			Assertions.assertSame(node, this.folders.getFolder(path).orElseThrow());
		}
	}

	@Test
	void addFolderCreatesAncestorsOnce() {
		var leaf = this.folders.addFolder("/projects/java/spring");
		Assertions.assertEquals("spring", leaf.name());
		Assertions.assertEquals(4, this.folders.size(), "root, projects, java and spring");
		var java = this.folders.getFolder("/projects/java").orElseThrow();
		Assertions.assertSame(java, leaf.parent());
		Assertions.assertSame(leaf, this.folders.addFolder("projects/java/spring"), "adding is idempotent");
		this.folders.addFolder("/projects/java/quarkus");
		Assertions.assertEquals(5, this.folders.size());
		Assertions.assertEquals(2, java.children().size());
	}

	@Test
	void root() {
		var root = this.folders.root();
		Assertions.assertTrue(root.isRoot());
		Assertions.assertNull(root.parent());
		Assertions.assertEquals("/", root.path());
		Assertions.assertEquals(FolderIndex.ROOT_NAME, root.name());
		Assertions.assertFalse(this.folders.deleteFolder("/"), "the root can't be deleted");
		Assertions.assertFalse(this.folders.deleteFolder(""), "the root can't be deleted");
		Assertions.assertTrue(this.folders.getFolder("/").isPresent());
	}

	@Test
	void deleteRemovesTheWholeSubtree() {
		this.folders.addFolder("/projects/java/spring/boot");
		this.folders.addFolder("/projects/go");
		this.folders.addDocumentToFolder("/projects/java/spring", "doc_1");
		Assertions.assertTrue(this.folders.deleteFolder("/projects/java/"));
		for (var gone : List.of("/projects/java", "/projects/java/spring", "/projects/java/spring/boot"))
			Assertions.assertTrue(this.folders.getFolder(gone).isEmpty(), gone + " should be gone");
		Assertions.assertTrue(this.folders.getFolder("/projects/go").isPresent());
		Assertions.assertEquals(1, this.folders.getFolder("/projects").orElseThrow().children().size());
		Assertions.assertEquals(3, this.folders.size());
		Assertions.assertFalse(this.folders.deleteFolder("/projects/java"), "it's already gone");
		Assertions.assertFalse(this.folders.deleteFolder("/nope"));
	}

	@Test
	void recreatingADeletedFolderStartsEmpty() {
		this.folders.addFolder("/inbox");
		this.folders.addDocumentToFolder("/inbox", "doc_1");
		this.folders.deleteFolder("/inbox");
		var inbox = this.folders.addFolder("/inbox");
		Assertions.assertTrue(inbox.documentIds().isEmpty());
	}

	@Test
	void documentMembership() {
		this.folders.addFolder("/inbox");
		Assertions.assertTrue(this.folders.addDocumentToFolder("/inbox", "doc_1"));
		Assertions.assertTrue(this.folders.addDocumentToFolder("inbox/", "doc_2"));
		Assertions.assertTrue(this.folders.addDocumentToFolder("/inbox", "doc_2"));
		Assertions.assertEquals(Set.of("doc_1", "doc_2"), this.folders.documentsInFolder("/inbox"));
		Assertions.assertTrue(this.folders.removeDocumentFromFolder("/inbox", "doc_1"));
		Assertions.assertEquals(Set.of("doc_2"), this.folders.documentsInFolder("/inbox"));
		Assertions.assertFalse(this.folders.addDocumentToFolder("/missing", "doc_3"), "no such folder");
		Assertions.assertFalse(this.folders.removeDocumentFromFolder("/missing", "doc_3"));
		Assertions.assertTrue(this.folders.documentsInFolder("/missing").isEmpty());
		Assertions.assertTrue(this.folders.getFolder("/missing").isEmpty(), "membership never creates folders");
	}

	@Test
	void documentsInSubtree() {
		this.folders.addFolder("/a/b/c");
		this.folders.addDocumentToFolder("/a", "doc_1");
		this.folders.addDocumentToFolder("/a/b", "doc_2");
		this.folders.addDocumentToFolder("/a/b/c", "doc_3");
		this.folders.addDocumentToFolder("/", "doc_4");
		Assertions.assertEquals(Set.of("doc_2", "doc_3"), this.folders.documentsInSubtree("/a/b"));
		Assertions.assertEquals(Set.of("doc_1", "doc_2", "doc_3", "doc_4"), this.folders.documentsInSubtree("/"));
		Assertions.assertTrue(this.folders.documentsInSubtree("/z").isEmpty());
	}

	@Test
	void traversals() {
		this.folders.addFolder("/a/b");
		this.folders.addFolder("/c");
		this.folders.addFolder("/a/d");
		this.folders.addDocumentToFolder("/a", "doc_1");
		var depthFirst = this.folders.traverseDepthFirst();
		Assertions.assertEquals(List.of("/", "/a", "/a/b", "/a/d", "/c"),
				depthFirst.stream().map(FolderSummary::path).toList());
		Assertions.assertEquals(new FolderSummary("/a", "a", 1, 2), depthFirst.get(1));
		Assertions.assertEquals(new FolderSummary("/", FolderIndex.ROOT_NAME, 0, 2), depthFirst.get(0));
		var breadthFirst = this.folders.traverseBreadthFirst();
		Assertions.assertEquals(List.of("/", "/a", "/c", "/a/b", "/a/d"),
				breadthFirst.stream().map(FolderSummary::path).toList());
	}

	@Test
	void deeplyNestedFolders() {
		var depth = 5_000;
		var path = "/x".repeat(depth);
		var leaf = Assertions.assertTimeout(Duration.ofSeconds(5), () -> this.folders.addFolder(path));
		Assertions.assertEquals(path, leaf.path());
		Assertions.assertEquals(depth + 1, this.folders.size());
		Assertions.assertEquals(depth + 1, this.folders.traverseDepthFirst().size());
		Assertions.assertEquals(depth + 1, this.folders.traverseBreadthFirst().size());

		Assertions.assertTrue(this.folders.deleteFolder("/x"));
		Assertions.assertEquals(1, this.folders.size(), "only the root is left");
		Assertions.assertTrue(this.folders.getFolder(path).isEmpty());
	}

}
