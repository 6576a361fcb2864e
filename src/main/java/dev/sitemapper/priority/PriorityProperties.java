package dev.sitemapper.priority;

import jakarta.annotation.PostConstruct;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the priority classification rules.
 *
 * <p>Properties are bound from {@code sitemapper.priority.*} in application.yml. Path markers are
 * matched as lowercase substrings of the URL path; {@code *-paths} entries must equal the path
 * exactly. The defaults form the reference ruleset for a site with a {@code /docs} section
 * (current docs plus a legacy {@code /docs/1.0.0} tree) and a {@code /blog}.
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if a root is
 * blank or the depth threshold is not positive.
 */
@Configuration
@ConfigurationProperties(prefix = "sitemapper.priority")
public class PriorityProperties {

  private List<String> hubPaths = List.of("/docs", "/blog");
  private List<String> hubMarkers = List.of("/gittogether");
  private List<String> productMarkers =
      List.of(
          "/pricing",
          "/api-testing",
          "/integration-testing",
          "/unit-test-generator",
          "/contract-testing",
          "/ai-code-generation",
          "/test-case-generator",
          "/test-data-generator",
          "/code-coverage",
          "/continuous-integration-testing",
          "/devscribe");
  private String blogRoot = "/blog";
  private List<String> blogCategoryPaths = List.of("/blog/technology", "/blog/community");
  private List<String> coreGuideMarkers =
      List.of(
          "/docs/running-keploy/",
          "/docs/ci-cd/",
          "/docs/dependencies/",
          "/docs/keploy-cloud/",
          "/docs/security");
  private List<String> quickstartMarkers =
      List.of("/docs/quickstart/", "/docs/server/installation/", "/docs/server/sdk-installation/");
  private List<String> tagListingMarkers = List.of("/blog/tag/");
  private List<String> conceptMarkers =
      List.of("/docs/concepts/", "/docs/keploy-explained/", "/docs/operation/");
  private List<String> applicationGuideMarkers = List.of("/docs/application-development/");
  private List<String> postMarkers = List.of("/blog/technology/", "/blog/community/");
  private String docsRoot = "/docs";
  private List<String> docsExclusionMarkers =
      List.of("/blog", "/pricing", "/api-testing", "/integration-testing", "/unit-test-generator");
  private String legacyDocsRoot = "/docs/1.0.0";
  private List<String> legacyLowValueMarkers = List.of("/glossary/", "/reference/", "/tags/");
  private List<String> tagCollectionMarkers = List.of("/docs/tags/", "/docs/1.0.0/tags/");
  private int maxSlashes = 5;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    requireRoot("blog-root", blogRoot);
    requireRoot("docs-root", docsRoot);
    requireRoot("legacy-docs-root", legacyDocsRoot);
    if (maxSlashes < 1) {
      throw new IllegalStateException(
          "sitemapper.priority.max-slashes must be >= 1, got: " + maxSlashes);
    }
  }

  private static void requireRoot(String name, String value) {
    if (value == null || value.isBlank() || !value.startsWith("/")) {
      throw new IllegalStateException(
          "sitemapper.priority." + name + " must be a path starting with '/', got: " + value);
    }
  }

  public List<String> getHubPaths() {
    return hubPaths;
  }

  public void setHubPaths(List<String> hubPaths) {
    this.hubPaths = hubPaths;
  }

  public List<String> getHubMarkers() {
    return hubMarkers;
  }

  public void setHubMarkers(List<String> hubMarkers) {
    this.hubMarkers = hubMarkers;
  }

  public List<String> getProductMarkers() {
    return productMarkers;
  }

  public void setProductMarkers(List<String> productMarkers) {
    this.productMarkers = productMarkers;
  }

  public String getBlogRoot() {
    return blogRoot;
  }

  public void setBlogRoot(String blogRoot) {
    this.blogRoot = blogRoot;
  }

  public List<String> getBlogCategoryPaths() {
    return blogCategoryPaths;
  }

  public void setBlogCategoryPaths(List<String> blogCategoryPaths) {
    this.blogCategoryPaths = blogCategoryPaths;
  }

  public List<String> getCoreGuideMarkers() {
    return coreGuideMarkers;
  }

  public void setCoreGuideMarkers(List<String> coreGuideMarkers) {
    this.coreGuideMarkers = coreGuideMarkers;
  }

  public List<String> getQuickstartMarkers() {
    return quickstartMarkers;
  }

  public void setQuickstartMarkers(List<String> quickstartMarkers) {
    this.quickstartMarkers = quickstartMarkers;
  }

  public List<String> getTagListingMarkers() {
    return tagListingMarkers;
  }

  public void setTagListingMarkers(List<String> tagListingMarkers) {
    this.tagListingMarkers = tagListingMarkers;
  }

  public List<String> getConceptMarkers() {
    return conceptMarkers;
  }

  public void setConceptMarkers(List<String> conceptMarkers) {
    this.conceptMarkers = conceptMarkers;
  }

  public List<String> getApplicationGuideMarkers() {
    return applicationGuideMarkers;
  }

  public void setApplicationGuideMarkers(List<String> applicationGuideMarkers) {
    this.applicationGuideMarkers = applicationGuideMarkers;
  }

  public List<String> getPostMarkers() {
    return postMarkers;
  }

  public void setPostMarkers(List<String> postMarkers) {
    this.postMarkers = postMarkers;
  }

  public String getDocsRoot() {
    return docsRoot;
  }

  public void setDocsRoot(String docsRoot) {
    this.docsRoot = docsRoot;
  }

  public List<String> getDocsExclusionMarkers() {
    return docsExclusionMarkers;
  }

  public void setDocsExclusionMarkers(List<String> docsExclusionMarkers) {
    this.docsExclusionMarkers = docsExclusionMarkers;
  }

  public String getLegacyDocsRoot() {
    return legacyDocsRoot;
  }

  public void setLegacyDocsRoot(String legacyDocsRoot) {
    this.legacyDocsRoot = legacyDocsRoot;
  }

  public List<String> getLegacyLowValueMarkers() {
    return legacyLowValueMarkers;
  }

  public void setLegacyLowValueMarkers(List<String> legacyLowValueMarkers) {
    this.legacyLowValueMarkers = legacyLowValueMarkers;
  }

  public List<String> getTagCollectionMarkers() {
    return tagCollectionMarkers;
  }

  public void setTagCollectionMarkers(List<String> tagCollectionMarkers) {
    this.tagCollectionMarkers = tagCollectionMarkers;
  }

  public int getMaxSlashes() {
    return maxSlashes;
  }

  public void setMaxSlashes(int maxSlashes) {
    this.maxSlashes = maxSlashes;
  }
}
