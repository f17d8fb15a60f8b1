package com.vuong.quickrepo.config;

import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.ManagedType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lookup of the persistent attributes of an entity through the JPA metamodel.
 * Fields the provider does not map, such as {@code @Transient} ones, are never returned.
 */
public final class EntityAttributes {

    private EntityAttributes() {
    }

    /**
     * Retrieves the persistent attribute with the given name, including inherited ones.
     * @param type the managed type to inspect
     * @param name the attribute name
     * @return the attribute, or {@code null} if the type has no such persistent attribute
     */
    public static Attribute<?, ?> getAttribute(ManagedType<?> type, String name) {
        for (Attribute<?, ?> attribute : type.getAttributes()) {
            if (attribute.getName().equals(name)) {
                return attribute;
            }
        }
        return null;
    }

    /**
     * Retrieves the names of the basic String attributes, which are the ones free-text search applies to.
     * @param type the managed type to inspect
     * @return names of all persistent String attributes
     */
    public static List<String> getSearchableAttributes(ManagedType<?> type) {
        return type.getAttributes().stream()
                .filter(attribute -> attribute.getPersistentAttributeType() == Attribute.PersistentAttributeType.BASIC)
                .filter(attribute -> attribute.getJavaType() == String.class)
                .map(Attribute::getName)
                .sorted()
                .collect(Collectors.toList());
    }
}
