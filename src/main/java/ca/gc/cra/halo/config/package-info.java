/**
 * Configuration loading, merging and adapter wiring.
 *
 * <p>Settings flow from {@link ca.gc.cra.halo.config.DefaultsForMode} through
 * {@link ca.gc.cra.halo.config.YamlConfigLoader} and CLI overrides, merged by
 * {@link ca.gc.cra.halo.config.ConfigMerger} into a {@link ca.gc.cra.halo.config.PipelineConfig}.
 */
package ca.gc.cra.halo.config;
