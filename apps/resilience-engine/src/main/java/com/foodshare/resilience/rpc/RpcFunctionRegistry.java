package com.foodshare.resilience.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Logical RPC function name → {@link RpcConfig}.
 *
 * Lookups read an immutable snapshot without locking. Registrations are serialized and publish
 * a fresh snapshot (copy-on-write), so a lookup never observes a half-applied update.
 * Unregistered names resolve to the {@code normal} preset.
 */
public class RpcFunctionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RpcFunctionRegistry.class);

    private static final List<String> STRICT_FUNCTIONS = List.of(
            "sign_in", "sign_up", "sign_out", "refresh_session", "reset_password",
            "delete_account", "request_account_deletion", "update_user_consent",
            "get_secret_audited", "get_user_messages_export");

    // Profile and listing mutations: normal envelope, always audited
    private static final List<String> AUDITED_MUTATIONS = List.of(
            "update_profile", "create_listing", "update_listing", "delete_listing",
            "mark_listing_arranged", "submit_review", "update_user_rating");

    private static final List<String> NORMAL_FUNCTIONS = List.of(
            "send_message", "get_or_create_room", "get_room_messages", "mark_messages_read",
            "update_room_last_message", "toggle_favorite", "toggle_bookmark", "toggle_forum_like",
            "toggle_forum_reaction", "toggle_forum_bookmark", "toggle_comment_reaction", "create_forum_post",
            "increment_forum_view", "get_post_reactions", "get_user_stats", "get_transaction_details",
            "get_paginated_notifications", "mark_read", "save_filter_preset", "send_feedback");

    private static final List<String> BULK_FUNCTIONS = List.of(
            "get_nearby_posts", "search_posts", "search_food_items", "search_food_items_advanced",
            "search_forum", "search_suggestions", "get_nearby_users", "get_search_history",
            "get_user_reviews_with_average", "get_reviews_with_average", "get_user_challenges_with_counts",
            "search_filter_presets");

    private static final List<String> SYNC_FUNCTIONS = List.of(
            "sync_delta", "sync_full", "sync_versions", "sync_tombstones", "sync_conflicts");

    private static final List<String> REALTIME_FUNCTIONS = List.of(
            "realtime_subscribe", "realtime_unsubscribe", "realtime_broadcast", "realtime_presence");

    private static final List<String> RELAXED_FUNCTIONS = List.of(
            "get_home_screen_data", "get_search_screen_data", "get_listing_detail_data",
            "get_notifications_screen", "get_bff_messages_data", "get_profile_analytics");

    private final Object writeLock = new Object();
    private final AtomicReference<Map<String, RpcConfig>> functions = new AtomicReference<>(Map.of());

    /**
     * Registry pre-populated with every known RPC function.
     */
    public static RpcFunctionRegistry withDefaults() {
        RpcFunctionRegistry registry = new RpcFunctionRegistry();
        Map<String, RpcConfig> defaults = new HashMap<>();
        STRICT_FUNCTIONS.forEach(fn -> defaults.put(fn, RpcPreset.STRICT.config()));
        NORMAL_FUNCTIONS.forEach(fn -> defaults.put(fn, RpcPreset.NORMAL.config()));
        AUDITED_MUTATIONS.forEach(fn -> defaults.put(fn, RpcPreset.NORMAL.config().withAuditLog(true)));
        BULK_FUNCTIONS.forEach(fn -> defaults.put(fn, RpcPreset.BULK.config()));
        SYNC_FUNCTIONS.forEach(fn -> defaults.put(fn, RpcPreset.SYNC.config()));
        REALTIME_FUNCTIONS.forEach(fn -> defaults.put(fn, RpcPreset.REALTIME.config()));
        RELAXED_FUNCTIONS.forEach(fn -> defaults.put(fn, RpcPreset.RELAXED.config()));
        registry.functions.set(Map.copyOf(defaults));
        return registry;
    }

    /**
     * Config for {@code functionName}; the {@code normal} preset when it is not registered.
     */
    public RpcConfig getConfig(@Nullable String functionName) {
        if (functionName == null) {
            return RpcPreset.NORMAL.config();
        }
        return functions.get().getOrDefault(functionName, RpcPreset.NORMAL.config());
    }

    public boolean requiresAuditLog(@Nullable String functionName) {
        return getConfig(functionName).requiresAuditLog();
    }

    public boolean isRegistered(String functionName) {
        return functions.get().containsKey(functionName);
    }

    /**
     * Register or replace the config for {@code functionName}.
     */
    public void register(String functionName, RpcConfig config) {
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(config, "config");
        synchronized (writeLock) {
            Map<String, RpcConfig> next = new HashMap<>(functions.get());
            next.put(functionName, config);
            functions.set(Map.copyOf(next));
        }
        logger.debug("Registered RPC config for {}: {}", functionName, config);
    }

    public void registerPreset(String functionName, @Nullable String presetName) {
        RpcPreset preset = RpcPreset.fromValue(presetName);
        register(functionName, preset.config());
        logger.info("RPC function {} -> preset {}", functionName, preset.value());
    }

    /**
     * Apply overrides of the form {@code "fn=preset,fn2=preset"}. Malformed entries are skipped.
     *
     * @return number of entries applied
     */
    public int applyPresetOverrides(@Nullable String overrides) {
        if (overrides == null || overrides.isBlank()) {
            return 0;
        }
        int applied = 0;
        for (String entry : overrides.split(",")) {
            String[] parts = entry.split("=", 2);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                logger.warn("Ignoring malformed RPC preset override '{}'", entry.trim());
                continue;
            }
            registerPreset(parts[0].trim(), parts[1].trim());
            applied++;
        }
        return applied;
    }

    /**
     * Current registrations sorted by name.
     */
    public Map<String, RpcConfig> registeredFunctions() {
        return new TreeMap<>(functions.get());
    }
}
