package github.sarthakdev143.slideshow_factory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SlideshowFactoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(SlideshowFactoryApplication.class, args);
	}

}
