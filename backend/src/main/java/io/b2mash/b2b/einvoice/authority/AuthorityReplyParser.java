package io.b2mash.b2b.einvoice.authority;

import io.b2mash.b2b.einvoice.authority.AuthorityReply.Message;
import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Reads the invoicing service's SOAP replies. Elements are matched by local name so the parser
 * does not depend on the prefixes the service chooses. Every method throws {@link
 * AuthorityProtocolException} when the reply is not well-formed or lacks a required element, and
 * {@link AuthorityFaultException} when the reply is a SOAP 1.1 or 1.2 fault.
 */
@Component
public class AuthorityReplyParser {

  private static final DateTimeFormatter WIRE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  public AuthorityReply parseAuthorization(String xml) {
    Document document = parse(xml);
    Element result = requireElement(document, "FECAESolicitarResult");

    Element detail = firstElement(result, "FECAEDetResponse");
    String outcome =
        detail != null
            ? text(detail, "Resultado")
            : text(firstElement(result, "FeCabResp"), "Resultado");
    String code = detail != null ? text(detail, "CAE") : null;
    LocalDate expiry = detail != null ? date(text(detail, "CAEFchVto")) : null;

    List<Message> observations = detail != null ? messages(detail, "Obs") : List.of();
    List<Message> errors = messages(result, "Err");
    List<Message> events = messages(result, "Evt");
    var allObservations = new ArrayList<>(observations);
    allObservations.addAll(events);

    if (outcome == null && errors.isEmpty()) {
      throw new AuthorityProtocolException("Reply carries neither a result nor errors");
    }
    return new AuthorityReply(outcome, blankToNull(code), expiry, allObservations, errors);
  }

  /** Reads {@code CbteNro} from a {@code FECompUltimoAutorizado} reply. */
  public long parseLastAuthorized(String xml) {
    Document document = parse(xml);
    Element result = requireElement(document, "FECompUltimoAutorizadoResult");
    List<Message> errors = messages(result, "Err");
    if (!errors.isEmpty()) {
      throw new AuthorityProtocolException("Authority reported errors: " + errors);
    }
    String number = text(result, "CbteNro");
    if (number == null) {
      throw new AuthorityProtocolException("Reply has no CbteNro");
    }
    try {
      return Long.parseLong(number);
    } catch (NumberFormatException e) {
      throw new AuthorityProtocolException("CbteNro is not a number: " + number, e);
    }
  }

  /**
   * Reads the code and expiry from a {@code FECompConsultar} reply. Empty when the Authority has
   * no such document.
   */
  public Optional<AuthorityReply> parseQuery(String xml) {
    Document document = parse(xml);
    Element result = requireElement(document, "FECompConsultarResult");
    Element found = firstElement(result, "ResultGet");
    if (found == null) {
      return Optional.empty();
    }
    String code = blankToNull(text(found, "CodAutorizacion"));
    if (code == null) {
      return Optional.empty();
    }
    return Optional.of(
        new AuthorityReply(
            text(found, "Resultado"),
            code,
            date(text(found, "FchVto")),
            messages(found, "Obs"),
            List.of()));
  }

  private static Document parse(String xml) {
    if (xml == null || xml.isBlank()) {
      throw new AuthorityProtocolException("Empty reply");
    }
    Document document;
    try {
      var factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      document = factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    } catch (ParserConfigurationException | SAXException | IOException e) {
      throw new AuthorityProtocolException("Malformed reply: " + e.getMessage(), e);
    }
    requireNoFault(document);
    return document;
  }

  private static void requireNoFault(Document document) {
    NodeList faults = document.getElementsByTagNameNS("*", "Fault");
    if (faults.getLength() == 0) {
      return;
    }
    Element fault = (Element) faults.item(0);
    // SOAP 1.2 nests Code/Value and Reason/Text, SOAP 1.1 uses faultcode and faultstring
    String code = text(firstElement(fault, "Code"), "Value");
    if (code == null) {
      code = text(fault, "faultcode");
    }
    String reason = text(firstElement(fault, "Reason"), "Text");
    if (reason == null) {
      reason = text(fault, "faultstring");
    }
    throw new AuthorityFaultException(
        code == null ? "unknown" : code, reason == null ? "no reason given" : reason);
  }

  private static Element requireElement(Document document, String localName) {
    NodeList nodes = document.getElementsByTagNameNS("*", localName);
    if (nodes.getLength() == 0) {
      throw new AuthorityProtocolException("Reply has no " + localName);
    }
    return (Element) nodes.item(0);
  }

  private static Element firstElement(Element parent, String localName) {
    if (parent == null) {
      return null;
    }
    NodeList nodes = parent.getElementsByTagNameNS("*", localName);
    return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
  }

  private static String text(Element parent, String localName) {
    Element element = firstElement(parent, localName);
    return element == null ? null : element.getTextContent().trim();
  }

  private static List<Message> messages(Element parent, String localName) {
    var result = new ArrayList<Message>();
    NodeList nodes = parent.getElementsByTagNameNS("*", localName);
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node instanceof Element element) {
        String code = text(element, "Code");
        result.add(new Message(code == null ? 0 : parseCode(code), text(element, "Msg")));
      }
    }
    return result;
  }

  private static int parseCode(String code) {
    try {
      return Integer.parseInt(code);
    } catch (NumberFormatException e) {
      throw new AuthorityProtocolException("Message code is not a number: " + code, e);
    }
  }

  private static LocalDate date(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value, WIRE_DATE);
    } catch (DateTimeParseException e) {
      throw new AuthorityProtocolException("Unparseable date: " + value, e);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
