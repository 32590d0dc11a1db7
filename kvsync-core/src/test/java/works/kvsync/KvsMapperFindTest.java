package works.kvsync;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.kvsync.annotations.KeyFormat;
import works.kvsync.exceptions.KvsPathException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static works.kvsync.KvsMapperEncodeTest.assertReason;
import static works.kvsync.Selector.field;
import static works.kvsync.Selector.key;
import static works.kvsync.exceptions.KvsPathException.Reason.INCOMPLETE_PATH;
import static works.kvsync.exceptions.KvsPathException.Reason.KEY_NOT_FOUND;
import static works.kvsync.exceptions.KvsPathException.Reason.KEY_WRONG_TYPE;
import static works.kvsync.exceptions.KvsPathException.Reason.MALFORMED_KEY;
import static works.kvsync.exceptions.KvsPathException.Reason.NOT_IMPLEMENTED;
import static works.kvsync.exceptions.KvsPathException.Reason.PATH_NOT_FOUND;
import static works.kvsync.exceptions.KvsPathException.Reason.PATH_PAST_OBJECT;
import static works.kvsync.exceptions.KvsPathException.Reason.SCALAR_TYPE;
import static works.kvsync.exceptions.KvsPathException.Reason.WRONG_FIELD_NAME;
import static works.kvsync.exceptions.KvsPathException.Reason.WRONG_FIELD_TYPE;

class KvsMapperFindTest {
	final KvsMapper mapper = new KvsMapper();
	Tree tree;

	record Leaf(int a, String b, double c) { }

	record Tree(
		@KeyFormat("in/blob") Leaf a,
		@KeyFormat("sub/path/") Leaf b,
		@KeyFormat("map1/{key}/in/here") Map<String, Leaf> c,
		@KeyFormat("map2/{key}/") Map<Integer, Leaf> d
	) { }

	record Odd(
		@KeyFormat("list/{index}") List<String> list,
		@KeyFormat("n/") int n
	) { }

	@BeforeEach
	void setupTree() {
		tree = new Tree(new Leaf(1, "one", 1.5), new Leaf(2, "two", 2.5), new HashMap<>(), new HashMap<>());
	}

	@Test
	void findByKey_singleValue() throws KvsPathException {
		Location location = mapper.findByKey(tree, "root/", "root/in/blob");
		assertSame(tree.a(), location.value());
		assertEquals(List.of(field("a")), location.fields());
		assertEquals("root/in/blob", location.key());
		assertSame(tree, location.root());

		assertEquals(List.of(field("a")), mapper.findByKey(tree, "/root/", "/root/in/blob").fields());
		assertEquals(List.of(field("a")), mapper.findByKey(tree, "", "in/blob").fields());
	}

	@Test
	void findByKey_leadingSlashFollowsTheFormat() throws KvsPathException {
		assertEquals("/root/in/blob", mapper.findByKey(tree, "/root/", "root/in/blob").key());
		assertEquals("root/in/blob", mapper.findByKey(tree, "root/", "/root/in/blob").key());
	}

	@Test
	void findByKey_pastSingleValue() {
		assertReason(PATH_PAST_OBJECT, () -> mapper.findByKey(tree, "root/", "root/in/blob/"));
		assertReason(PATH_PAST_OBJECT, () -> mapper.findByKey(tree, "root/", "root/in/blob/nya"));
		assertReason(PATH_PAST_OBJECT, () -> mapper.findByKey(tree, "", "in/blob/"));
	}

	@Test
	void findByKey_mismatchedLiterals() {
		assertReason(PATH_NOT_FOUND, () -> mapper.findByKey(tree, "root/", "rot/in/blob"));
		assertReason(PATH_NOT_FOUND, () -> mapper.findByKey(tree, "root/", "root/in2/blob"));
		assertReason(PATH_NOT_FOUND, () -> mapper.findByKey(tree, "", "sub/"));
	}

	@Test
	void findByKey_nestedStruct() throws KvsPathException {
		assertReason(INCOMPLETE_PATH, () -> mapper.findByKey(tree, "", "sub/path"));

		Location struct = mapper.findByKey(tree, "", "sub/path/");
		assertSame(tree.b(), struct.value());
		assertEquals(List.of(field("b")), struct.fields());

		Location inner = mapper.findByKey(tree, "", "sub/path/a");
		assertEquals(2, inner.value());
		assertEquals(List.of(field("b"), field("a")), inner.fields());
	}

	@Test
	void findByKey_mapWithLiteralsAfterKey() throws KvsPathException {
		Location map = mapper.findByKey(tree, "", "map1/");
		assertSame(tree.c(), map.value());
		assertEquals(List.of(field("c")), map.fields());

		assertReason(PATH_NOT_FOUND, () -> mapper.findByKey(tree, "", "map1/testkey/nnn"));
		assertReason(PATH_NOT_FOUND, () -> mapper.findByKey(tree, "", "map1/testkey/"));
		assertReason(INCOMPLETE_PATH, () -> mapper.findByKey(tree, "", "map1/testkey"));
		assertReason(INCOMPLETE_PATH, () -> mapper.findByKey(tree, "", "map1/testkey/in"));
		assertReason(KEY_NOT_FOUND, () -> mapper.findByKey(tree, "", "map1/testkey/in/here"));

		Leaf entry = new Leaf(3, "three", 3.5);
		tree.c().put("testkey", entry);
		Location found = mapper.findByKey(tree, "", "map1/testkey/in/here");
		assertSame(entry, found.value());
		assertEquals(List.of(field("c"), key("testkey")), found.fields());
	}

	@Test
	void findByKey_mapOfStructs() throws KvsPathException {
		assertReason(INCOMPLETE_PATH, () -> mapper.findByKey(tree, "", "map2/111"));
		assertReason(KEY_NOT_FOUND, () -> mapper.findByKey(tree, "", "map2/111/"));
		assertReason(PATH_NOT_FOUND, () -> mapper.findByKey(tree, "", "map2/111/nnn"));
		assertReason(MALFORMED_KEY, () -> mapper.findByKey(tree, "", "map2/abc/"));

		Leaf entry = new Leaf(4, "four", 4.5);
		tree.d().put(111, entry);
		Location found = mapper.findByKey(tree, "", "map2/111/");
		assertSame(entry, found.value());
		assertEquals(List.of(field("d"), key(111)), found.fields());
		assertEquals("map2/111/", found.key());

		Location a = mapper.findByKey(tree, "", "map2/111/a");
		assertEquals(4, a.value());
		assertEquals(List.of(field("d"), key(111), field("a")), a.fields());
		assertReason(PATH_NOT_FOUND, () -> mapper.findByKey(tree, "", "map2/111/nnn"));
	}

	@Test
	void findByKey_firstMatchingFieldWins() {
		record Shadowed(
			@KeyFormat("{key}/x") Map<String, String> any,
			@KeyFormat("fixed/") Leaf fixed
		) { }
		Shadowed shadowed = new Shadowed(Map.of(), new Leaf(1, "", 1.5));
		assertReason(PATH_NOT_FOUND, () -> mapper.findByKey(shadowed, "/", "/fixed/a"));
	}

	@Test
	void findByKey_unsupportedShapes() {
		Odd odd = new Odd(List.of("x"), 5);
		assertReason(NOT_IMPLEMENTED, () -> mapper.findByKey(odd, "/", "/list/0"));
		assertReason(SCALAR_TYPE, () -> mapper.findByKey(odd, "/", "/n/x"));
	}

	@Test
	void findByFields_paths() throws KvsPathException {
		Location ba = mapper.findByFields(tree, "store/here/", "b", "a");
		assertEquals(2, ba.value());
		assertEquals("store/here/sub/path/a", ba.key());

		Location a = mapper.findByFields(tree, "store/here/", "a");
		assertSame(tree.a(), a.value());
		assertEquals("store/here/in/blob", a.key());

		assertEquals("/store/here/in/blob", mapper.findByFields(tree, "/store/here/", "a").key());
	}

	@Test
	void findByFields_errors() {
		assertReason(PATH_PAST_OBJECT, () -> mapper.findByFields(tree, "store/here/", "a", "a"));
		assertReason(KEY_NOT_FOUND, () -> mapper.findByFields(tree, "store/here/", "c", "key"));
		assertReason(PATH_PAST_OBJECT, () -> mapper.findByFields(tree, "store/here/", "c", "key", "a"));
		assertReason(KEY_WRONG_TYPE, () -> mapper.findByFields(tree, "store/here/", "d", "key"));
		assertReason(KEY_NOT_FOUND, () -> mapper.findByFields(tree, "store/here/", "d", 1));
		assertReason(WRONG_FIELD_NAME, () -> mapper.findByFields(tree, "store/here/", "nope"));
		assertReason(WRONG_FIELD_TYPE, () -> mapper.findByFields(tree, "store/here/", 1));
		assertReason(WRONG_FIELD_TYPE, () -> mapper.findByFields(tree, "store/here/", key("a")));
		assertReason(KEY_WRONG_TYPE, () -> mapper.findByFields(tree, "store/here/", "d", field("a")));
	}

	@Test
	void findByFields_nullMaps() {
		Tree sparse = new Tree(new Leaf(0, "", 0.0), new Leaf(0, "", 0.0), null, null);
		assertReason(KEY_NOT_FOUND, () -> mapper.findByFields(sparse, "store/here/", "c", "key"));
		assertReason(PATH_PAST_OBJECT, () -> mapper.findByFields(sparse, "store/here/", "c", "key", "a"));
		assertReason(KEY_NOT_FOUND, () -> mapper.findByFields(sparse, "store/here/", "d", 1));
	}

	@Test
	void findByFields_mapEntries() throws KvsPathException {
		tree.c().put("key", new Leaf(1, "test", 0.5));
		assertReason(PATH_PAST_OBJECT, () -> mapper.findByFields(tree, "store/here/", "c", "key", "a"));
		Location c = mapper.findByFields(tree, "store/here/", "c", "key");
		assertEquals(new Leaf(1, "test", 0.5), c.value());
		assertEquals("store/here/map1/key/in/here", c.key());

		tree.d().put(1, new Leaf(1, "test", 0.5));
		Location d = mapper.findByFields(tree, "store/here/", "d", 1);
		assertEquals(new Leaf(1, "test", 0.5), d.value());
		assertEquals("store/here/map2/1/", d.key());

		Location da = mapper.findByFields(tree, "store/here/", field("d"), key(1), field("a"));
		assertEquals(1, da.value());
		assertEquals("store/here/map2/1/a", da.key());
		assertEquals(List.of(field("d"), key(1), field("a")), da.fields());

		assertEquals("test", mapper.findByFields(tree, "store/here/", "d", 1, "b").value());
	}

	@Test
	void findByFields_noSelectors_findsTheRoot() throws KvsPathException {
		Location root = mapper.findByFields(tree, "/t/");
		assertSame(tree, root.value());
		assertEquals("/t/", root.key());
		assertEquals(List.of(), root.fields());
	}
}
