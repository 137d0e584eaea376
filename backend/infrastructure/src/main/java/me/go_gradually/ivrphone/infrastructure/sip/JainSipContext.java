package me.go_gradually.ivrphone.infrastructure.sip;

import javax.sip.SipProvider;
import javax.sip.SipStack;
import javax.sip.address.Address;
import javax.sip.address.AddressFactory;
import javax.sip.address.SipURI;
import javax.sip.header.ContactHeader;
import javax.sip.header.HeaderFactory;
import javax.sip.message.MessageFactory;
import java.text.ParseException;

/**
 * The running stack and the factories every SIP adapter builds messages with.
 */
public record JainSipContext(SipStack stack,
                             SipProvider provider,
                             MessageFactory messageFactory,
                             HeaderFactory headerFactory,
                             AddressFactory addressFactory,
                             ListenAddressResolver.ListenAddress listenAddress,
                             int port,
                             String transport) {

    public String localEndpoint() {
        return transport + ":" + listenAddress.uriHost() + ":" + port;
    }

    public ContactHeader contactHeader(String user) throws ParseException {
        SipURI uri = addressFactory.createSipURI(user, listenAddress.uriHost());
        uri.setPort(port);
        uri.setTransportParam(transport);
        Address address = addressFactory.createAddress(uri);
        return headerFactory.createContactHeader(address);
    }
}
