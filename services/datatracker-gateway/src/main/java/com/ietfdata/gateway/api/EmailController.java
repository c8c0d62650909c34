package com.ietfdata.gateway.api;

import com.ietfdata.client.Datatracker;
import com.ietfdata.model.Email;
import com.ietfdata.model.uri.EmailUri;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/emails")
public class EmailController {

    private final Datatracker datatracker;

    public EmailController(Datatracker datatracker) {
        this.datatracker = datatracker;
    }

    @GetMapping("/{address:.+}/history")
    public TimelineResponse<Email> history(@PathVariable String address) {
        return TimelineResponse.of(datatracker.emailHistory(EmailUri.of(address)));
    }

    @GetMapping("/{address:.+}")
    public Email email(@PathVariable String address) {
        return datatracker.email(address);
    }
}
