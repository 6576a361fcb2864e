package dev.sitemapper.snapshot;

import dev.sitemapper.crawl.PageRecord;
import dev.sitemapper.crawl.SitemapStore;
import java.io.StringWriter;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link SitemapStore} as a sitemaps.org 0.9 {@code urlset} document.
 *
 * <p>One {@code <url>} per page, sorted by URL, each with {@code <loc>}, {@code <lastmod>}
 * ({@code YYYY-MM-DD}) and {@code <priority>} (two decimals). Text content is escaped by StAX.
 */
@Component
public class SitemapXmlWriter {

  static final String SITEMAP_NAMESPACE = "http://www.sitemaps.org/schemas/sitemap/0.9";
  static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
  static final String SCHEMA_LOCATION =
      SITEMAP_NAMESPACE + " http://www.sitemaps.org/schemas/sitemap/0.9/sitemap.xsd";

  private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

  private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

  /**
   * Render the sitemap document.
   *
   * @param store the recorded pages
   * @return the XML text, starting with the XML declaration
   */
  public String render(SitemapStore store) {
    StringWriter out = new StringWriter();
    out.write(XML_DECLARATION);
    try {
      XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out);
      xml.writeStartElement("urlset");
      xml.writeDefaultNamespace(SITEMAP_NAMESPACE);
      xml.writeNamespace("xsi", XSI_NAMESPACE);
      xml.writeAttribute("xsi", XSI_NAMESPACE, "schemaLocation", SCHEMA_LOCATION);

      for (PageRecord record : store.sorted().values()) {
        xml.writeCharacters("\n  ");
        xml.writeStartElement("url");
        writeElement(xml, "loc", record.url());
        writeElement(xml, "lastmod", record.lastModified().format(DateTimeFormatter.ISO_LOCAL_DATE));
        writeElement(xml, "priority", String.format(Locale.US, "%.2f", record.priority()));
        xml.writeCharacters("\n  ");
        xml.writeEndElement();
      }

      xml.writeCharacters("\n");
      xml.writeEndElement();
      xml.flush();
      xml.close();
    } catch (XMLStreamException e) {
      throw new IllegalStateException("Could not render sitemap XML", e);
    }
    out.write("\n");
    return out.toString();
  }

  private static void writeElement(XMLStreamWriter xml, String name, String text)
      throws XMLStreamException {
    xml.writeCharacters("\n    ");
    xml.writeStartElement(name);
    xml.writeCharacters(text);
    xml.writeEndElement();
  }
}
