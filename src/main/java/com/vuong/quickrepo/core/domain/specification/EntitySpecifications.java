package com.vuong.quickrepo.core.domain.specification;

import com.vuong.quickrepo.config.EntityAttributes;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.ClassUtils;
import org.springframework.util.NumberUtils;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Factory methods for JPA Specifications, meant to be passed to
 * {@link com.vuong.quickrepo.core.domain.query.EntityQuery#where(Specification)}.
 * Map based filters support strings, booleans, numbers, enums and relationship ids.
 */
public final class EntitySpecifications {

    /** Filter key that searches all String attributes. */
    public static final String SEARCH_KEY = "search";

    private static final String RELATION_IDS_SUFFIX = "Ids";

    private EntitySpecifications() {
    }

    /**
     * Matches entities whose attribute equals the given value.
     * @param attribute the attribute name
     * @param value the expected value; {@code null} matches entities where the attribute is null
     * @param <T> the entity type
     * @return the specification
     */
    public static <T> Specification<T> attributeEquals(String attribute, Object value) {
        Objects.requireNonNull(attribute, "Attribute cannot be null");
        return (root, query, cb) -> value == null
                ? cb.isNull(root.get(attribute))
                : cb.equal(root.get(attribute), value);
    }

    /**
     * Builds a specification from a map of filters for the given entity class. All entries must match.
     * <ul>
     *     <li>{@code search}: any String attribute contains the value</li>
     *     <li>{@code <relation>Ids}: the related entity's id is one of the comma separated values</li>
     *     <li>String attributes: contain the value</li>
     *     <li>boolean, numeric and enum attributes: equal the parsed value</li>
     * </ul>
     * Entries with blank values, unknown attributes or values that cannot be converted are ignored.
     *
     * @param filters     attribute names to filter values (e.g. "genre" -> "FICTION", "search" -> "java")
     * @param entityClass the JPA entity class to build the specification for
     * @param <T>         the entity type
     * @return the specification
     */
    public static <T> Specification<T> matching(Map<String, String> filters, Class<T> entityClass) {
        Objects.requireNonNull(entityClass, "Entity class cannot be null");
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filters == null) {
                return cb.conjunction();
            }

            filters.forEach((key, value) -> {
                if (!StringUtils.hasText(key) || !StringUtils.hasText(value)) {
                    return;
                }
                if (SEARCH_KEY.equals(key)) {
                    handleSearch(value, root, cb, predicates);
                } else if (key.endsWith(RELATION_IDS_SUFFIX)) {
                    handleRelationFilter(key, value, root, query, predicates);
                } else {
                    handleAttributeFilter(key, value, root, cb, predicates);
                }
            });

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static <T> void handleSearch(String value, Root<T> root, CriteriaBuilder cb, List<Predicate> predicates) {
        List<Predicate> orPredicates = new ArrayList<>();
        for (String attribute : EntityAttributes.getSearchableAttributes(root.getModel())) {
            orPredicates.add(cb.like(root.get(attribute), "%" + value + "%"));
        }
        if (!orPredicates.isEmpty()) {
            predicates.add(cb.or(orPredicates.toArray(new Predicate[0])));
        }
    }

    private static <T> void handleRelationFilter(String key, String value, Root<T> root, CriteriaQuery<?> query,
                                                 List<Predicate> predicates) {
        String relation = key.substring(0, key.length() - RELATION_IDS_SUFFIX.length());
        Attribute<?, ?> attribute = EntityAttributes.getAttribute(root.getModel(), relation);
        if (attribute == null || !(attribute.isAssociation() || attribute.isCollection())) {
            return;
        }
        try {
            List<Long> ids = Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(StringUtils::hasText)
                    .map(Long::valueOf)
                    .toList();
            Join<T, Object> join = root.join(relation, JoinType.LEFT);
            predicates.add(join.get("id").in(ids));
            if (attribute.isCollection()) {
                // one row per matching element
                query.distinct(true);
            }
        } catch (NumberFormatException e) {
            // Ignore ids that are not numeric
        }
    }

    private static <T> void handleAttributeFilter(String key, String value, Root<T> root, CriteriaBuilder cb,
                                                  List<Predicate> predicates) {
        Attribute<?, ?> attribute = EntityAttributes.getAttribute(root.getModel(), key);
        if (attribute == null || attribute.getPersistentAttributeType() != Attribute.PersistentAttributeType.BASIC) {
            return;
        }

        Class<?> type = ClassUtils.resolvePrimitiveIfNecessary(attribute.getJavaType());
        try {
            if (type == String.class) {
                predicates.add(cb.like(root.get(key), "%" + value + "%"));
            } else if (type == Boolean.class) {
                predicates.add(cb.equal(root.get(key), Boolean.valueOf(value)));
            } else if (type.isEnum()) {
                @SuppressWarnings({"unchecked", "rawtypes"})
                Object enumValue = Enum.valueOf((Class<Enum>) type, value);
                predicates.add(cb.equal(root.get(key), enumValue));
            } else if (Number.class.isAssignableFrom(type)) {
                @SuppressWarnings("unchecked")
                Number number = NumberUtils.parseNumber(value, (Class<Number>) type);
                predicates.add(cb.equal(root.get(key), number));
            }
        } catch (IllegalArgumentException e) {
            // Ignore values that cannot be converted to the attribute type
        }
    }
}
