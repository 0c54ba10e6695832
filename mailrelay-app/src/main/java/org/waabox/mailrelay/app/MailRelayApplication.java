package org.waabox.mailrelay.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the MailRelay service.
 *
 * <p>Receives Gmail change notifications pushed by Google Cloud Pub/Sub,
 * resolves them against the mailbox history and POSTs every qualifying new
 * message to the configured webhook.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class MailRelayApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(MailRelayApplication.class, args);
  }
}
