package com.example.workoutlog;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class WorkoutLogApplicationTests {

	/**
	 * Ensures the application context loads without throwing exceptions.
	 */
	@Test
	void contextLoads() {
	}

}
