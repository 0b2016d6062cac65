package incident.commander;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IncidentCommanderApplication {

  public static void main(String[] args) {
    SpringApplication.run(IncidentCommanderApplication.class, args);
  }
}
