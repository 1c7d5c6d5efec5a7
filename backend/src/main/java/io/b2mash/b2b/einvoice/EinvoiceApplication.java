package io.b2mash.b2b.einvoice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EinvoiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(EinvoiceApplication.class, args);
  }
}
