package dev.sitemapper.priority;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maps a normalized URL to a sitemap priority through an ordered, first-match-wins rule list.
 *
 * <p>Rules overlap on purpose (a deep blog post is both a post and deeply nested), so their order
 * is the tie-break: the first matching rule decides the tier. All matching is done on the
 * lowercased URL path with plain substring tests.
 *
 * <ol>
 *   <li>home page (empty path or {@code /}): {@link PriorityTier#HIGHEST}
 *   <li>hub paths and hub markers: {@link PriorityTier#HIGHEST}
 *   <li>product markers: {@link PriorityTier#HIGH}
 *   <li>blog categories (listed paths, or exactly two {@code /} under the blog root): {@link
 *       PriorityTier#HIGH}
 *   <li>core guide markers: {@link PriorityTier#HIGH}
 *   <li>quickstart and installation markers: {@link PriorityTier#MEDIUM}
 *   <li>tag listings: {@link PriorityTier#MEDIUM}
 *   <li>concept pages outside the legacy tree, application guides: {@link PriorityTier#STANDARD}
 *   <li>individual posts that are not tag listings: {@link PriorityTier#STANDARD}
 *   <li>other current docs not claimed by marketing paths: {@link PriorityTier#STANDARD}
 *   <li>legacy docs: low-value pages {@link PriorityTier#LOW}, others {@link
 *       PriorityTier#STANDARD}
 *   <li>tag collections: {@link PriorityTier#LOW}
 *   <li>paths with more {@code /} than the configured threshold: {@link PriorityTier#LOW}
 *   <li>anything else: {@link PriorityTier#STANDARD}
 * </ol>
 */
@Service
public class PriorityClassifier {

  private static final Logger log = LoggerFactory.getLogger(PriorityClassifier.class);

  private static final PriorityTier DEFAULT_TIER = PriorityTier.STANDARD;

  private final List<Rule> rules;

  public PriorityClassifier(PriorityProperties properties) {
    this.rules = buildRules(properties);
  }

  /**
   * Priority of a URL in [0, 1].
   *
   * @param url a normalized absolute URL, or a bare path
   * @return the priority of the first matching tier
   */
  public double classify(String url) {
    return classifyTier(url).priority();
  }

  /**
   * Tier of a URL, for callers that need the category rather than the number.
   *
   * @param url a normalized absolute URL, or a bare path
   * @return the first matching tier, {@link PriorityTier#STANDARD} if no rule matches
   */
  public PriorityTier classifyTier(String url) {
    String path = pathOf(url);
    for (Rule rule : rules) {
      if (rule.matches().test(path)) {
        log.debug("{} matched rule {} ({})", url, rule.name(), rule.tier());
        return rule.tier();
      }
    }
    log.debug("{} matched no rule ({})", url, DEFAULT_TIER);
    return DEFAULT_TIER;
  }

  private static List<Rule> buildRules(PriorityProperties p) {
    List<String> hubPaths = lowerAll(p.getHubPaths());
    List<String> hubMarkers = lowerAll(p.getHubMarkers());
    List<String> productMarkers = lowerAll(p.getProductMarkers());
    String blogRoot = lower(p.getBlogRoot());
    List<String> blogCategoryPaths = lowerAll(p.getBlogCategoryPaths());
    List<String> coreGuideMarkers = lowerAll(p.getCoreGuideMarkers());
    List<String> quickstartMarkers = lowerAll(p.getQuickstartMarkers());
    List<String> tagListingMarkers = lowerAll(p.getTagListingMarkers());
    List<String> conceptMarkers = lowerAll(p.getConceptMarkers());
    List<String> applicationGuideMarkers = lowerAll(p.getApplicationGuideMarkers());
    List<String> postMarkers = lowerAll(p.getPostMarkers());
    String docsPrefix = lower(p.getDocsRoot()) + "/";
    List<String> docsExclusionMarkers = lowerAll(p.getDocsExclusionMarkers());
    String legacyRoot = lower(p.getLegacyDocsRoot());
    String legacyPrefix = legacyRoot + "/";
    List<String> legacyLowValueMarkers = lowerAll(p.getLegacyLowValueMarkers());
    List<String> tagCollectionMarkers = lowerAll(p.getTagCollectionMarkers());
    int maxSlashes = p.getMaxSlashes();

    Predicate<String> outsideLegacy = path -> !path.contains(legacyRoot);

    List<Rule> rules = new ArrayList<>();
    rules.add(new Rule("home", path -> path.isEmpty() || path.equals("/"), PriorityTier.HIGHEST));
    rules.add(
        new Rule(
            "hub",
            path -> hubPaths.contains(withoutTrailingSlash(path)) || containsAny(path, hubMarkers),
            PriorityTier.HIGHEST));
    rules.add(new Rule("product", path -> containsAny(path, productMarkers), PriorityTier.HIGH));
    rules.add(
        new Rule(
            "blog-category",
            path ->
                blogCategoryPaths.contains(path)
                    || (path.startsWith(blogRoot + "/") && countSlashes(path) == 2),
            PriorityTier.HIGH));
    rules.add(new Rule("core-guide", path -> containsAny(path, coreGuideMarkers), PriorityTier.HIGH));
    rules.add(
        new Rule("quickstart", path -> containsAny(path, quickstartMarkers), PriorityTier.MEDIUM));
    rules.add(
        new Rule("tag-listing", path -> containsAny(path, tagListingMarkers), PriorityTier.MEDIUM));
    rules.add(
        new Rule(
            "concept",
            path ->
                (containsAny(path, conceptMarkers) && outsideLegacy.test(path))
                    || containsAny(path, applicationGuideMarkers),
            PriorityTier.STANDARD));
    rules.add(
        new Rule(
            "post",
            path -> containsAny(path, postMarkers) && !containsAny(path, tagListingMarkers),
            PriorityTier.STANDARD));
    rules.add(
        new Rule(
            "current-docs",
            path ->
                path.contains(docsPrefix)
                    && outsideLegacy.test(path)
                    && !containsAny(path, docsExclusionMarkers),
            PriorityTier.STANDARD));
    rules.add(
        new Rule(
            "legacy-low-value",
            path -> path.contains(legacyPrefix) && containsAny(path, legacyLowValueMarkers),
            PriorityTier.LOW));
    rules.add(new Rule("legacy", path -> path.contains(legacyPrefix), PriorityTier.STANDARD));
    rules.add(
        new Rule("tag-collection", path -> containsAny(path, tagCollectionMarkers), PriorityTier.LOW));
    rules.add(new Rule("deep", path -> countSlashes(path) > maxSlashes, PriorityTier.LOW));
    return List.copyOf(rules);
  }

  private static String pathOf(String url) {
    if (url == null) {
      return "";
    }
    String path = url;
    int schemeEnd = url.indexOf("://");
    if (schemeEnd > 0) {
      int end = schemeEnd + 3;
      while (end < url.length() && "/?#".indexOf(url.charAt(end)) < 0) {
        end++;
      }
      path = url.substring(end);
    }
    int query = path.indexOf('?');
    if (query >= 0) {
      path = path.substring(0, query);
    }
    int fragment = path.indexOf('#');
    if (fragment >= 0) {
      path = path.substring(0, fragment);
    }
    return path.toLowerCase(Locale.ROOT);
  }

  private static String withoutTrailingSlash(String path) {
    int end = path.length();
    while (end > 1 && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(0, end);
  }

  private static boolean containsAny(String path, List<String> markers) {
    for (String marker : markers) {
      if (path.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  private static int countSlashes(String path) {
    int count = 0;
    for (int i = 0; i < path.length(); i++) {
      if (path.charAt(i) == '/') {
        count++;
      }
    }
    return count;
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }

  private static List<String> lowerAll(List<String> values) {
    return values == null
        ? List.of()
        : values.stream()
            .filter(value -> value != null && !value.isEmpty())
            .map(PriorityClassifier::lower)
            .toList();
  }

  private record Rule(String name, Predicate<String> matches, PriorityTier tier) {}
}
