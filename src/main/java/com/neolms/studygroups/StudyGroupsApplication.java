package com.neolms.studygroups;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StudyGroupsApplication {

	public static void main(String[] args) {
		SpringApplication.run(StudyGroupsApplication.class, args);
	}

}
