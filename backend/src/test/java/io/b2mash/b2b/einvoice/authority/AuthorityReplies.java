package io.b2mash.b2b.einvoice.authority;

import io.b2mash.b2b.einvoice.authority.request.AuthorizationRequestBuilder;
import io.b2mash.b2b.einvoice.authority.signing.SignedRequest;
import io.b2mash.b2b.einvoice.authority.signing.SimulatedRequestSigner;
import io.b2mash.b2b.einvoice.invoice.AmountCalculator;
import io.b2mash.b2b.einvoice.invoice.Invoice;
import io.b2mash.b2b.einvoice.invoice.InvoiceFixtures;

/** Canned invoicing service replies and signed requests. */
final class AuthorityReplies {

  static final AuthorityCredentials CREDENTIALS =
      new AuthorityCredentials(
          "20123456789", 5, null, null, "http://localhost", AuthorityEnvironment.TESTING);

  private AuthorityReplies() {}

  static SignedRequest signedRequest(long sequenceNumber) {
    return signedRequest(InvoiceFixtures.invoice(sequenceNumber));
  }

  static SignedRequest signedRequest(Invoice invoice) {
    var document =
        new AuthorizationRequestBuilder(new AmountCalculator()).build(invoice, CREDENTIALS);
    return new SimulatedRequestSigner().sign(document, CREDENTIALS);
  }

  static String approved(String code, String expiry) {
    return envelope(
        "FECAESolicitar",
        header("A")
            + "<FeDetResp><FECAEDetResponse><Concepto>1</Concepto><DocTipo>80</DocTipo>"
            + "<DocNro>30712345671</DocNro><CbteDesde>42</CbteDesde><CbteHasta>42</CbteHasta>"
            + "<CbteFch>20240517</CbteFch><Resultado>A</Resultado>"
            + "<Observaciones><Obs><Code>10217</Code><Msg>Recipient condition not checked</Msg>"
            + "</Obs></Observaciones>"
            + "<CAE>"
            + code
            + "</CAE><CAEFchVto>"
            + expiry
            + "</CAEFchVto></FECAEDetResponse></FeDetResp>");
  }

  static String rejectedWithObservation(int code, String message) {
    return envelope(
        "FECAESolicitar",
        header("R")
            + "<FeDetResp><FECAEDetResponse><Resultado>R</Resultado>"
            + "<Observaciones><Obs><Code>"
            + code
            + "</Code><Msg>"
            + message
            + "</Msg></Obs></Observaciones>"
            + "<CAE></CAE><CAEFchVto></CAEFchVto></FECAEDetResponse></FeDetResp>");
  }

  static String error(int code, String message) {
    return envelope(
        "FECAESolicitar",
        "<Errors><Err><Code>" + code + "</Code><Msg>" + message + "</Msg></Err></Errors>");
  }

  static String query(String code, String expiry) {
    return envelope(
        "FECompConsultar",
        "<ResultGet><Concepto>1</Concepto><CbteDesde>42</CbteDesde><Resultado>A</Resultado>"
            + "<CodAutorizacion>"
            + code
            + "</CodAutorizacion><EmisionTipo>CAE</EmisionTipo><FchVto>"
            + expiry
            + "</FchVto></ResultGet>");
  }

  static String queryNotFound() {
    return envelope(
        "FECompConsultar",
        "<Errors><Err><Code>602</Code><Msg>No results for the given filter</Msg></Err></Errors>");
  }

  static String lastAuthorized(long number) {
    return envelope(
        "FECompUltimoAutorizado",
        "<PtoVta>5</PtoVta><CbteTipo>1</CbteTipo><CbteNro>" + number + "</CbteNro>");
  }

  /** SOAP 1.2 fault, as the service sends it with HTTP 500. */
  static String fault(String code, String reason) {
    return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
        + "<soap:Envelope xmlns:soap=\"http://www.w3.org/2003/05/soap-envelope\"><soap:Body>"
        + "<soap:Fault><soap:Code><soap:Value>"
        + code
        + "</soap:Value></soap:Code><soap:Reason><soap:Text xml:lang=\"en\">"
        + reason
        + "</soap:Text></soap:Reason></soap:Fault></soap:Body></soap:Envelope>";
  }

  static String soap11Fault(String code, String reason) {
    return "<soap:Envelope xmlns:soap=\"http://schemas.xmlsoap.org/soap/envelope/\"><soap:Body>"
        + "<soap:Fault><faultcode>"
        + code
        + "</faultcode><faultstring>"
        + reason
        + "</faultstring></soap:Fault></soap:Body></soap:Envelope>";
  }

  private static String header(String result) {
    return "<FeCabResp><Cuit>20123456789</Cuit><PtoVta>5</PtoVta><CbteTipo>1</CbteTipo>"
        + "<FchProceso>20240517</FchProceso><CantReg>1</CantReg><Resultado>"
        + result
        + "</Resultado></FeCabResp>";
  }

  private static String envelope(String operation, String result) {
    return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
        + "<soap:Envelope xmlns:soap=\"http://www.w3.org/2003/05/soap-envelope\"><soap:Body>"
        + "<"
        + operation
        + "Response xmlns=\"http://ar.gov.afip.dif.FEV1/\"><"
        + operation
        + "Result>"
        + result
        + "</"
        + operation
        + "Result></"
        + operation
        + "Response></soap:Body></soap:Envelope>";
  }
}
