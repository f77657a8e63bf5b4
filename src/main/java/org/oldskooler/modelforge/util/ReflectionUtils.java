package org.oldskooler.modelforge.util;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public final class ReflectionUtils {
    private ReflectionUtils() {}

    /**
     * Instance fields in declaration order, superclass fields first.
     */
    public static List<Field> getInstanceFields(Class<?> c) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> k = c; k != null && k != Object.class; k = k.getSuperclass()) {
            hierarchy.push(k);
        }
        ArrayList<Field> out = new ArrayList<>();
        for (Class<?> k : hierarchy) {
            for (Field f : k.getDeclaredFields()) {
                if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) continue;
                out.add(f);
            }
        }
        return out;
    }

    /** Looks a field up by name on the type or its superclasses; null when absent. */
    public static Field findField(Class<?> c, String name) {
        for (Class<?> k = c; k != null && k != Object.class; k = k.getSuperclass()) {
            try {
                Field f = k.getDeclaredField(name);
                if (!Modifier.isStatic(f.getModifiers())) return f;
            } catch (NoSuchFieldException ignored) {
                // keep walking up
            }
        }
        return null;
    }

    public static Object getField(Object target, Field f) throws IllegalAccessException {
        f.setAccessible(true);
        return f.get(target);
    }

    public static <T> T newInstance(Class<T> type) throws ReflectiveOperationException {
        java.lang.reflect.Constructor<T> ctor = type.getDeclaredConstructor();
        ctor.setAccessible(true);
        return ctor.newInstance();
    }
}
