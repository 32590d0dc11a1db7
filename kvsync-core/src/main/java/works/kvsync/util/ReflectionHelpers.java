package works.kvsync.util;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.Opcodes;

import static org.objectweb.asm.ClassReader.SKIP_CODE;
import static org.objectweb.asm.ClassReader.SKIP_DEBUG;
import static org.objectweb.asm.ClassReader.SKIP_FRAMES;

public final class ReflectionHelpers {
	private ReflectionHelpers() { }

	/**
	 * {@link Class#getDeclaredFields()} makes no promise about order,
	 * so this reads the order from the class file instead.
	 *
	 * @return the fields declared by {@code cls} itself, in source order
	 * @throws IllegalArgumentException if the class file can't be read
	 */
	public static List<Field> getDeclaredFieldsInOrder(Class<?> cls) {
		Map<String, Field> byName = new LinkedHashMap<>();
		for (Field f : cls.getDeclaredFields()) {
			byName.put(f.getName(), f);
		}
		List<Field> result = new ArrayList<>(byName.size());
		for (String name : fieldNamesFromClassFile(cls)) {
			Field field = byName.get(name);
			if (field == null) {
				throw new IllegalStateException("Class file of " + cls.getName() + " declares field \"" + name + "\" that reflection does not report");
			}
			result.add(field);
		}
		return result;
	}

	private static List<String> fieldNamesFromClassFile(Class<?> cls) {
		String resourceName = "/" + cls.getName().replace('.', '/') + ".class";
		List<String> names = new ArrayList<>();
		try (InputStream in = cls.getResourceAsStream(resourceName)) {
			if (in == null) {
				throw new IllegalArgumentException("Class file not found for " + cls.getName());
			}
			new ClassReader(in).accept(new ClassVisitor(Opcodes.ASM9) {
				@Override
				public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
					names.add(name);
					return null;
				}
			}, SKIP_CODE | SKIP_DEBUG | SKIP_FRAMES);
		} catch (IOException e) {
			throw new IllegalArgumentException("Unable to read class file of " + cls.getName(), e);
		}
		return names;
	}
}
