package com.joshlong.organizer.api.folders;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class FolderConfiguration {

	@Bean
	FolderIndex folderIndex() {
		return new FolderIndex();
	}

}
