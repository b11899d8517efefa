package es.gestorfiscal.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Fiscal ledger of a self-employed professional: income and expense records,
 * document numbering, integrity checks and the AEAT tax model figures.
 */
@SpringBootApplication
@ComponentScan(basePackages = "es.gestorfiscal")
public class LedgerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerServiceApplication.class, args);
    }
}
