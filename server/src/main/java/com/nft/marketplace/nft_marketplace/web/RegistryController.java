package com.nft.marketplace.nft_marketplace.web;

import java.security.Principal;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.nft.marketplace.nft_marketplace.entity.Collection;
import com.nft.marketplace.nft_marketplace.entity.Nft;
import com.nft.marketplace.nft_marketplace.service.RegistryService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RegistryController {

    private final RegistryService registryService;

    @PostMapping("/collections")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Long> createCollection(Principal caller, @RequestBody Requests.CreateCollection request) {
        long collectionId = registryService.createCollection(caller.getName(), request.getName());
        return Map.of("collectionId", collectionId);
    }

    @GetMapping("/collections/{collectionId}")
    public Collection getCollection(@PathVariable long collectionId) {
        return registryService.getCollection(collectionId);
    }

    @PostMapping("/collections/{collectionId}/nfts")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Long> mint(Principal caller, @PathVariable long collectionId, @RequestBody Requests.Mint request) {
        long tokenId = registryService.mintNFT(caller.getName(), collectionId, request.getName(), request.getPrice());
        return Map.of("tokenId", tokenId);
    }

    @GetMapping("/collections/{collectionId}/nfts")
    public List<Nft> nftsByCollection(@PathVariable long collectionId) {
        return registryService.getNFTsByCollection(collectionId);
    }

    @GetMapping("/nfts/{tokenId}")
    public Nft getNFT(@PathVariable long tokenId) {
        return registryService.getNFT(tokenId);
    }

    @GetMapping("/nfts/{tokenId}/exists")
    public Map<String, Boolean> tokenExists(@PathVariable long tokenId) {
        return Map.of("exists", registryService.tokenExists(tokenId));
    }

    @PostMapping("/nfts/{tokenId}/transfer")
    public Map<String, String> transfer(Principal caller, @PathVariable long tokenId, @RequestBody Requests.Transfer request) {
        registryService.transferNFT(caller.getName(), tokenId, request.getTo());
        return Map.of("owner", request.getTo());
    }

    @GetMapping("/accounts/{address}/collections")
    public List<Collection> creatorCollections(@PathVariable String address) {
        return registryService.getCreatorCollections(address);
    }

    @GetMapping("/accounts/{address}/nfts")
    public List<Nft> nftsByOwner(@PathVariable String address) {
        return registryService.getNFTsByOwner(address);
    }
}
