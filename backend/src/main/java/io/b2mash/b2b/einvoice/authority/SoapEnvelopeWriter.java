package io.b2mash.b2b.einvoice.authority;

import io.b2mash.b2b.einvoice.authority.request.RequestDetail;
import io.b2mash.b2b.einvoice.authority.request.TaxBreakdownEntry;
import io.b2mash.b2b.einvoice.authority.signing.AuthorizationHeader;
import io.b2mash.b2b.einvoice.authority.signing.SignedRequest;
import java.io.StringWriter;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/** Writes the SOAP 1.2 envelopes for the invoicing service operations. */
@Component
public class SoapEnvelopeWriter {

  static final String SOAP_NAMESPACE = "http://www.w3.org/2003/05/soap-envelope";
  static final String SERVICE_NAMESPACE = "http://ar.gov.afip.dif.FEV1/";

  /** {@code FECAESolicitar}: request an authorization code for one invoice. */
  public String authorizationRequest(SignedRequest request) {
    var document = request.document();
    var envelope = new Envelope("FECAESolicitar", request.authorization());

    Element caeRequest = envelope.child(envelope.operation, "FeCAEReq");
    Element header = envelope.child(caeRequest, "FeCabReq");
    envelope.text(header, "CantReg", document.header().recordCount());
    envelope.text(header, "PtoVta", document.header().salesPoint());
    envelope.text(header, "CbteTipo", document.header().documentTypeCode());

    Element detailList = envelope.child(caeRequest, "FeDetReq");
    Element detail = envelope.child(detailList, "FECAEDetRequest");
    RequestDetail d = document.detail();
    envelope.text(detail, "Concepto", d.conceptCode());
    envelope.text(detail, "DocTipo", d.recipientDocumentTypeCode());
    envelope.text(detail, "DocNro", d.recipientDocumentNumber());
    envelope.text(detail, "CbteDesde", d.sequenceFrom());
    envelope.text(detail, "CbteHasta", d.sequenceTo());
    envelope.text(detail, "CbteFch", d.issueDate());
    envelope.text(detail, "ImpTotal", d.totalAmount());
    envelope.text(detail, "ImpTotConc", d.nonTaxedAmount());
    envelope.text(detail, "ImpNeto", d.netAmount());
    envelope.text(detail, "ImpOpEx", d.exemptAmount());
    envelope.text(detail, "ImpIVA", d.taxAmount());
    envelope.text(detail, "ImpTrib", d.otherTributesAmount());
    envelope.text(detail, "MonId", d.currencyCode());
    envelope.text(detail, "MonCotiz", d.exchangeRate());

    Element vat = envelope.child(detail, "Iva");
    for (TaxBreakdownEntry entry : d.taxBreakdown()) {
      Element rate = envelope.child(vat, "AlicIva");
      envelope.text(rate, "Id", entry.rateCode());
      envelope.text(rate, "BaseImp", entry.baseAmount());
      envelope.text(rate, "Importe", entry.taxAmount());
    }
    return envelope.serialize();
  }

  /** {@code FECompUltimoAutorizado}: last number authorized for a sales point and type. */
  public String lastAuthorizedRequest(
      AuthorizationHeader authorization, int salesPoint, int documentTypeCode) {
    var envelope = new Envelope("FECompUltimoAutorizado", authorization);
    envelope.text(envelope.operation, "PtoVta", salesPoint);
    envelope.text(envelope.operation, "CbteTipo", documentTypeCode);
    return envelope.serialize();
  }

  /** {@code FECompConsultar}: details of an already authorized document. */
  public String queryRequest(
      AuthorizationHeader authorization,
      int salesPoint,
      int documentTypeCode,
      long sequenceNumber) {
    var envelope = new Envelope("FECompConsultar", authorization);
    Element query = envelope.child(envelope.operation, "FeCompConsReq");
    envelope.text(query, "CbteTipo", documentTypeCode);
    envelope.text(query, "CbteNro", sequenceNumber);
    envelope.text(query, "PtoVta", salesPoint);
    return envelope.serialize();
  }

  private static final class Envelope {

    private final Document document;
    private final Element operation;

    Envelope(String operationName, AuthorizationHeader authorization) {
      try {
        var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        this.document = factory.newDocumentBuilder().newDocument();
      } catch (ParserConfigurationException e) {
        throw new IllegalStateException("XML parser unavailable", e);
      }
      Element root = document.createElementNS(SOAP_NAMESPACE, "soap:Envelope");
      root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:ar", SERVICE_NAMESPACE);
      document.appendChild(root);
      root.appendChild(document.createElementNS(SOAP_NAMESPACE, "soap:Header"));
      Element body = document.createElementNS(SOAP_NAMESPACE, "soap:Body");
      root.appendChild(body);
      this.operation = child(body, operationName);

      Element auth = child(operation, "Auth");
      text(auth, "Token", authorization.token());
      text(auth, "Sign", authorization.sign());
      text(auth, "Cuit", authorization.issuerTaxId());
    }

    Element child(Element parent, String name) {
      Element element = document.createElementNS(SERVICE_NAMESPACE, "ar:" + name);
      parent.appendChild(element);
      return element;
    }

    void text(Element parent, String name, Object value) {
      child(parent, name).setTextContent(String.valueOf(value));
    }

    String serialize() {
      try {
        var transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        var out = new StringWriter();
        transformer.transform(new DOMSource(document), new StreamResult(out));
        return out.toString();
      } catch (TransformerException e) {
        throw new IllegalStateException("SOAP envelope could not be serialized", e);
      }
    }
  }
}
