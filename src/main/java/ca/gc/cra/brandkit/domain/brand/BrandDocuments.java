package ca.gc.cra.brandkit.domain.brand;

import ca.gc.cra.brandkit.domain.error.RegistryValidationException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Document keys and conversions between stored brand documents and {@link Brand}.
 *
 * <p>Documents are nested {@code Map<String, Object>} / {@code List<Object>} / scalar trees as produced by
 * the YAML store. Conversion validates that each known section has the expected shape and keeps unknown
 * top-level keys as extensions.</p>
 *
 * @since 0.1.0
 */
public final class BrandDocuments {
  public static final String BRAND = "brand";
  public static final String COLORS = "colors";
  public static final String TYPOGRAPHY = "typography";
  public static final String LAYOUT = "layout";
  public static final String ASSETS = "assets";
  public static final String TEMPLATES = "templates";
  public static final String TEMPLATE_OPTIONS = "template_options";
  public static final String PDF_SETTINGS = "pdf_settings";
  public static final String COMPLIANCE = "compliance";
  public static final String METADATA = "metadata";

  public static final String IS_PROTECTED = "is_protected";
  public static final String PROTECTION_LEVEL = "protection_level";
  public static final String PROTECTED_BY = "protected_by";
  public static final String PROTECTED_AT = "protected_at";
  public static final String PROTECTION_REASON = "protection_reason";

  public static final String META_CREATED_AT = "created_at";
  public static final String META_UPDATED_AT = "updated_at";
  public static final String META_VERSION = "version";
  public static final String META_STATUS = "status";
  public static final String META_TEMPLATE_SOURCE = "template_source";

  /** Version stamped on newly created brands and templates. */
  public static final String INITIAL_VERSION = "1.0.0";

  /** Top-level sections every brand document should carry. */
  public static final List<String> REQUIRED_SECTIONS = List.of(BRAND, COLORS);

  /** Protection keys stripped from copies and rewritten by lock/unlock. */
  public static final List<String> PROTECTION_KEYS =
      List.of(IS_PROTECTED, PROTECTION_LEVEL, PROTECTED_BY, PROTECTED_AT, PROTECTION_REASON);

  private static final Set<String> KNOWN_KEYS = Set.of(
      BRAND, COLORS, TYPOGRAPHY, LAYOUT, ASSETS, TEMPLATES, TEMPLATE_OPTIONS, PDF_SETTINGS, COMPLIANCE,
      METADATA, IS_PROTECTED, PROTECTION_LEVEL, PROTECTED_BY, PROTECTED_AT, PROTECTION_REASON);

  private BrandDocuments() {
    // Utility
  }

  /**
   * Converts a stored document into a typed {@link Brand}.
   *
   * @param name brand directory name
   * @param directory absolute brand directory; relative asset paths resolve against it
   * @param document stored document
   * @param fileExists probe used to flag each asset path as resolved
   * @return typed brand
   * @throws RegistryValidationException if a known section has the wrong shape
   */
  public static Brand toBrand(
      String name, Path directory, Map<String, Object> document, Predicate<Path> fileExists) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(fileExists, "fileExists");

    Map<String, Object> info = section(name, document, BRAND);
    Map<String, Object> metadata = section(name, document, METADATA);
    Map<String, Object> typography = section(name, document, TYPOGRAPHY);
    Map<String, String> colors = stringSection(name, document, COLORS);
    Map<String, String> layout = stringSection(name, document, LAYOUT);

    BrandIdentity identity = new BrandIdentity(
        text(info.get("name"), name),
        text(info.get("tagline"), ""),
        text(info.get("website"), ""),
        text(info.get("community"), ""));

    Map<String, Object> extensions = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : document.entrySet()) {
      if (!KNOWN_KEYS.contains(entry.getKey())) {
        extensions.put(entry.getKey(), deepCopyValue(entry.getValue()));
      }
    }

    return new Brand(
        name,
        directory,
        identity,
        colors,
        typography,
        layout,
        resolveAssets(name, directory, section(name, document, ASSETS), fileExists),
        stringSection(name, document, TEMPLATES),
        section(name, document, TEMPLATE_OPTIONS),
        section(name, document, PDF_SETTINGS),
        section(name, document, COMPLIANCE),
        BrandStatus.parseOr(text(metadata.get(META_STATUS), null), BrandStatus.ACTIVE),
        text(metadata.get(META_VERSION), INITIAL_VERSION),
        text(metadata.get(META_CREATED_AT), null),
        text(metadata.get(META_UPDATED_AT), null),
        text(metadata.get(META_TEMPLATE_SOURCE), null),
        protection(name, document),
        extensions,
        deepCopy(document),
        CssVariables.generate(colors, typography, layout));
  }

  /**
   * Reads the protection sub-record from top-level document keys.
   *
   * @param name brand name for diagnostics
   * @param document stored document
   * @return protection state; absent keys default to unprotected
   * @throws RegistryValidationException if {@code protection_level} holds an unknown value
   */
  public static BrandProtection protection(String name, Map<String, Object> document) {
    Object flag = document.get(IS_PROTECTED);
    boolean isProtected = flag instanceof Boolean b ? b : flag != null && Boolean.parseBoolean(flag.toString());
    ProtectionLevel level;
    try {
      level = ProtectionLevel.fromValue(text(document.get(PROTECTION_LEVEL), null));
    } catch (IllegalArgumentException ex) {
      throw new RegistryValidationException(name, ex.getMessage(), ex);
    }
    return new BrandProtection(
        isProtected,
        level,
        text(document.get(PROTECTED_BY), null),
        text(document.get(PROTECTED_AT), null),
        text(document.get(PROTECTION_REASON), ""));
  }

  /**
   * Returns a document fragment that writes {@code protection} onto a brand.
   *
   * @param protection state to write
   * @return partial document holding the five protection keys
   */
  public static Map<String, Object> protectionFragment(BrandProtection protection) {
    Map<String, Object> fragment = new LinkedHashMap<>();
    fragment.put(IS_PROTECTED, protection.isProtected());
    fragment.put(PROTECTION_LEVEL, protection.level().value());
    fragment.put(PROTECTED_BY, protection.protectedBy());
    fragment.put(PROTECTED_AT, protection.protectedAt());
    fragment.put(PROTECTION_REASON, protection.reason());
    return fragment;
  }

  /**
   * Lists advisory structure problems such as missing required sections.
   *
   * @param document document to inspect
   * @return warnings, empty when the structure is complete
   */
  public static List<String> structureWarnings(Map<String, Object> document) {
    List<String> warnings = new ArrayList<>();
    for (String required : REQUIRED_SECTIONS) {
      if (!document.containsKey(required)) {
        warnings.add("Missing required section: " + required);
      }
    }
    return warnings;
  }

  /**
   * Returns a nested section as a mapping.
   *
   * @param name entity name for diagnostics
   * @param document containing document
   * @param key section key
   * @return mutable copy of the section, empty when absent or {@code null}
   * @throws RegistryValidationException if the section is present but not a mapping
   */
  public static Map<String, Object> section(String name, Map<String, Object> document, String key) {
    Object value = document.get(key);
    if (value == null) {
      return new LinkedHashMap<>();
    }
    if (!(value instanceof Map<?, ?> raw)) {
      throw new RegistryValidationException(name, "Section '" + key + "' must be a mapping");
    }
    return asStringKeyed(name, raw, key);
  }

  /**
   * Deep-copies a document tree; nested maps become {@link LinkedHashMap} and lists {@link ArrayList}.
   *
   * @param document source document; {@code null} yields an empty map
   * @return independent mutable copy
   */
  public static Map<String, Object> deepCopy(Map<String, ?> document) {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (document == null) {
      return copy;
    }
    for (Map.Entry<String, ?> entry : document.entrySet()) {
      copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
    }
    return copy;
  }

  /**
   * Wraps a map read-only while preserving insertion order and {@code null} values.
   *
   * @param source map to wrap; {@code null} yields an empty map
   * @param <V> value type
   * @return unmodifiable copy
   */
  public static <V> Map<String, V> readOnly(Map<String, V> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /**
   * Derives a display name from a directory-style name: underscores become spaces and words are title-cased.
   *
   * @param name brand directory name
   * @return display name such as {@code "Acme Corp"} for {@code acme_corp}
   */
  public static String displayName(String name) {
    StringBuilder out = new StringBuilder(name.length());
    boolean startOfWord = true;
    for (char c : name.replace('_', ' ').toCharArray()) {
      if (Character.isLetter(c)) {
        out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
        startOfWord = false;
      } else {
        out.append(c);
        startOfWord = true;
      }
    }
    return out.toString();
  }

  private static Map<String, AssetReference> resolveAssets(
      String name, Path directory, Map<String, Object> assets, Predicate<Path> fileExists) {
    Map<String, AssetReference> resolved = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : assets.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof List<?> list) {
        List<ResolvedAsset> paths = new ArrayList<>();
        for (Object item : list) {
          if (item != null && !item.toString().isBlank()) {
            paths.add(resolve(name, directory, item.toString(), fileExists));
          }
        }
        if (!paths.isEmpty()) {
          resolved.put(entry.getKey(), new AssetReference(entry.getKey(), paths, true));
        }
      } else if (value instanceof Map<?, ?>) {
        throw new RegistryValidationException(name, "Asset '" + entry.getKey() + "' must be a path or a list of paths");
      } else if (value != null && !value.toString().isBlank()) {
        resolved.put(entry.getKey(),
            new AssetReference(entry.getKey(), List.of(resolve(name, directory, value.toString(), fileExists)), false));
      }
    }
    return resolved;
  }

  private static ResolvedAsset resolve(String name, Path directory, String declared, Predicate<Path> fileExists) {
    Path candidate;
    try {
      candidate = Path.of(declared);
    } catch (InvalidPathException ex) {
      throw new RegistryValidationException(name, "Invalid asset path: " + declared, ex);
    }
    Path absolute = (candidate.isAbsolute() ? candidate : directory.resolve(candidate)).normalize();
    return new ResolvedAsset(declared, absolute, fileExists.test(absolute));
  }

  private static Map<String, String> stringSection(String name, Map<String, Object> document, String key) {
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : section(name, document, key).entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof List<?>) {
        throw new RegistryValidationException(name,
            "Section '" + key + "' entry '" + entry.getKey() + "' must be a scalar");
      }
      if (value != null) {
        out.put(entry.getKey(), value.toString());
      }
    }
    return out;
  }

  private static Map<String, Object> asStringKeyed(String name, Map<?, ?> raw, String context) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (entry.getKey() == null) {
        throw new RegistryValidationException(name, "Section '" + context + "' contains a null key");
      }
      map.put(entry.getKey().toString(), deepCopyValue(entry.getValue()));
    }
    return map;
  }

  private static Object deepCopyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(String.valueOf(entry.getKey()), deepCopyValue(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(deepCopyValue(item));
      }
      return copy;
    }
    return value;
  }

  private static String text(Object value, String fallback) {
    if (value == null) {
      return fallback;
    }
    String text = value.toString();
    return text.isEmpty() && fallback != null ? fallback : text;
  }
}
