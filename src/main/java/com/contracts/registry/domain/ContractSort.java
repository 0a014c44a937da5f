package com.contracts.registry.domain;

import java.util.Locale;

import org.springframework.data.domain.Sort;

/**
 * Sortable columns of a contract lookup and the Spring Data {@link Sort}
 * built from loose request values. Defaults to newest first (id descending).
 */
public final class ContractSort {

    public static final Sort DEFAULT = Sort.by(Sort.Direction.DESC, SortKey.ID.getKey());

    private ContractSort() {
    }

    /**
     * Builds a sort from loose request values.
     *
     * @param key one of id, number, end_date; anything else sorts by id
     * @param direction "asc" for ascending, anything else descending
     * @return the sort on a whitelisted column
     */
    public static Sort of(String key, String direction) {
        boolean asc = direction != null && direction.trim().equalsIgnoreCase("asc");
        return Sort.by(asc ? Sort.Direction.ASC : Sort.Direction.DESC, SortKey.fromKey(key).getKey());
    }

    public enum SortKey {
        ID("id"),
        NUMBER("number"),
        END_DATE("end_date");

        private final String key;

        SortKey(String key) {
            this.key = key;
        }

        /**
         * Column name, also used as the {@link Sort.Order} property.
         */
        public String getKey() {
            return key;
        }

        public static SortKey fromKey(String key) {
            if (key == null) {
                return ID;
            }
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (SortKey sortKey : values()) {
                if (sortKey.key.equals(normalized)) {
                    return sortKey;
                }
            }
            return ID;
        }
    }
}
